package prose;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import prose.exec.ExecutionException;
import prose.exec.ExecutionResult;
import prose.exec.PythonEvaluator;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line front end: translate a file (or stdin) and optionally run the
 * result.
 *
 * Exit status is 0 on success, 1 when translation or execution fails and 2 on
 * bad arguments.
 */
public final class Main {
	private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
	// strong reference keeps the PROSE_DEBUG level
	private static final Logger ROOT = Logger.getLogger("prose");

	static final int OK = 0;
	static final int FAILED = 1;
	static final int USAGE = 2;

	private Main() {
	}

	public static void main(String[] args) {
		configureLogging();
		System.exit(run(args, System.in, System.out, System.err));
	}

	static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
		ArgumentParser parser = parser();
		Namespace ns;
		try {
			ns = parser.parseArgs(args);
		} catch (HelpScreenException e) {
			return OK;
		} catch (ArgumentParserException e) {
			err.println(e.getMessage());
			PrintWriter usage = new PrintWriter(err, true);
			parser.printUsage(usage);
			return USAGE;
		}

		if (ns.getBoolean("examples")) {
			out.println(SupportedPatterns.describe());
			return OK;
		}

		if (ns.getLong("timeout") <= 0) {
			err.println("--timeout must be positive");
			return USAGE;
		}

		String input;
		try {
			input = readInput(ns.getString("file"), in);
		} catch (IOException e) {
			err.println("Could not read input: " + e.getMessage());
			return USAGE;
		}

		TranslationResult result = new Translator().translateToResult(input);
		if (!result.success()) {
			return report(result, ns.getBoolean("json"), out, err);
		}

		if (ns.getBoolean("run")) {
			PythonEvaluator evaluator = new PythonEvaluator(ns.getString("python"),
					Duration.ofMillis(ns.getLong("timeout")));
			try {
				result = result.withExecution(evaluator.execute(result.code()));
			} catch (ExecutionException e) {
				LOGGER.log(Level.WARNING, "Execution failed", e);
				err.println(e.getMessage());
				return FAILED;
			}
		}
		return report(result, ns.getBoolean("json"), out, err);
	}

	private static int report(TranslationResult result, boolean json, PrintStream out, PrintStream err) {
		if (json) {
			out.println(result.toJson());
		} else if (!result.success()) {
			err.println(result.errorMessage());
		} else {
			for (String warning : result.warnings()) {
				err.println(warning);
			}
			out.println(result.code());
			ExecutionResult execution = result.execution();
			if (execution != null) {
				if (execution.hasOutput()) {
					out.print(execution.stdout());
				}
				if (!execution.success()) {
					err.println(execution.errorMessage());
				}
			}
		}

		if (!result.success()) {
			if (result.errorKind() == ErrorKind.UNRECOGNIZED_STATEMENT && !json) {
				err.println();
				err.println(SupportedPatterns.describe());
			}
			return FAILED;
		}
		ExecutionResult execution = result.execution();
		return execution == null || execution.success() ? OK : FAILED;
	}

	private static String readInput(String file, InputStream in) throws IOException {
		if (file == null || "-".equals(file)) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		return Files.readString(Path.of(file), StandardCharsets.UTF_8);
	}

	private static ArgumentParser parser() {
		ArgumentParser parser = ArgumentParsers.newFor("prose").build()
				.defaultHelp(true)
				.description("Translate pseudo-English instructions into Python source.");

		parser.addArgument("file").nargs("?")
				.help("file holding the instructions; standard input when absent");
		parser.addArgument("--run").action(Arguments.storeTrue())
				.help("execute the generated program and print its output");
		parser.addArgument("--json").action(Arguments.storeTrue())
				.help("print the result as JSON");
		parser.addArgument("--examples").action(Arguments.storeTrue())
				.help("list the supported sentence patterns and exit");
		parser.addArgument("--timeout").type(Long.class).setDefault(ProseConfig.EXEC_TIMEOUT_MS)
				.help("execution time limit in milliseconds");
		parser.addArgument("--python").setDefault(ProseConfig.PYTHON_COMMAND)
				.help("interpreter used by --run");
		return parser;
	}

	private static void configureLogging() {
		try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
			if (config != null) {
				LogManager.getLogManager().readConfiguration(config);
			}
		} catch (IOException e) {
			System.err.println("Could not load logging configuration: " + e.getMessage());
		}
		if (ProseConfig.DEBUG) {
			ROOT.setLevel(Level.FINE);
		}
	}
}
