package prose;

import prose.ast.Arithmetic;
import prose.ast.Assignment;
import prose.ast.CollectionLiteral;
import prose.ast.Instruction;
import prose.parse.PatternMatcher;
import prose.parse.StatementSplitter;
import prose.print.PythonPrinter;
import prose.resolve.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Public entrypoint for pseudo-English to Python translation.
 *
 * Pipeline per input: validate, split into statements, then for each
 * statement in order match it, print it against the names declared so far and
 * record what it declares. The first failing statement aborts the batch.
 */
public final class Translator {
	private static final Logger LOGGER = Logger.getLogger(Translator.class.getName());

	private final InputValidator validator;
	private final PatternMatcher matcher = new PatternMatcher();
	private final StatementSplitter splitter = new StatementSplitter(matcher::recognizes);
	private final PythonPrinter printer = new PythonPrinter();

	public Translator() {
		this(new InputValidator());
	}

	public Translator(InputValidator validator) {
		this.validator = validator;
	}

	/**
	 * Translates {@code input} in a session of its own.
	 */
	public Translation translate(String input) throws TranslationException {
		return translate(input, new TranslationSession());
	}

	/**
	 * Translates {@code input} against the names {@code session} already knows.
	 * Names declared here become visible to later calls only if the whole input
	 * translates.
	 */
	public Translation translate(String input, TranslationSession session) throws TranslationException {
		session.lock().lock();
		try {
			validator.validate(input);
			List<String> statements = splitter.split(input);
			if (statements.isEmpty()) {
				throw new TranslationException(ErrorKind.EMPTY_INPUT, "", "No statements found in input");
			}

			SymbolTable staged = session.table().copy();
			List<String> fragments = new ArrayList<>();
			List<String> warnings = new ArrayList<>();
			Set<String> undefined = new TreeSet<>();
			for (int i = 0; i < statements.size(); i++) {
				String statement = statements.get(i);
				Instruction instruction;
				try {
					instruction = matcher.match(statement);
				} catch (TranslationException e) {
					LOGGER.log(Level.FINE, "Statement {0} failed: {1}", new Object[] { i + 1, e.reason() });
					throw e.atStatement(i + 1);
				}
				fragments.add(printer.print(instruction, staged));
				undefined.addAll(TranslationWarnings.undefinedNames(instruction, staged));
				declare(instruction, staged);
				warnings.addAll(TranslationWarnings.check(instruction));
				LOGGER.log(Level.FINE, "Statement {0} ''{1}'' -> {2}",
						new Object[] { i + 1, statement, instruction.getClass().getSimpleName() });
			}

			if (!undefined.isEmpty()) {
				warnings.add(TranslationWarnings.undefinedSummary(undefined));
			}
			if (statements.size() > 1) {
				warnings.add(TranslationWarnings.batchSummary(statements.size()));
				LOGGER.log(Level.INFO, "Translated {0} statements", statements.size());
			}
			session.table().declareAll(staged.names());
			return new Translation(String.join(PythonPrinter.NL, fragments), warnings, statements.size());
		} finally {
			session.lock().unlock();
		}
	}

	/**
	 * Like {@link #translate(String)} but reports failures in the result
	 * instead of throwing.
	 */
	public TranslationResult translateToResult(String input) {
		long started = System.nanoTime();
		try {
			Translation translation = translate(input);
			return TranslationResult.success(input, translation, elapsedMillis(started));
		} catch (TranslationException e) {
			return TranslationResult.failure(input, e, elapsedMillis(started));
		}
	}

	private static void declare(Instruction instruction, SymbolTable symbols) {
		if (instruction instanceof Assignment a) {
			symbols.declare(a.name());
		} else if (instruction instanceof Arithmetic a) {
			symbols.declare(a.destination());
		} else if (instruction instanceof CollectionLiteral c) {
			symbols.declare(c.kind().variableName());
		}
	}

	private static long elapsedMillis(long startedNanos) {
		return (System.nanoTime() - startedNanos) / 1_000_000L;
	}
}
