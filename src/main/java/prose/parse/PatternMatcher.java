package prose.parse;

import prose.ErrorKind;
import prose.SupportedPatterns;
import prose.TranslationException;
import prose.ast.Arithmetic;
import prose.ast.ArithmeticOp;
import prose.ast.Assignment;
import prose.ast.CollectionKind;
import prose.ast.CollectionLiteral;
import prose.ast.CollectionLiteral.Element;
import prose.ast.Comparator;
import prose.ast.Conditional;
import prose.ast.Instruction;
import prose.ast.ListAppend;
import prose.ast.Literal;
import prose.ast.Loop;
import prose.ast.Operand;
import prose.ast.WhileLoop;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one statement against an ordered rule table.
 *
 * Rules are tried most specific first and the first rule that builds an
 * instruction wins:
 * <ol>
 * <li>conditionals with an else branch</li>
 * <li>conditionals without one</li>
 * <li>arithmetic, including "set X to A plus B"</li>
 * <li>assignment</li>
 * <li>collections</li>
 * <li>loops: repeat, while, for each</li>
 * </ol>
 * Every pattern must cover the whole statement.
 */
public final class PatternMatcher {
	private static final Logger LOGGER = Logger.getLogger(PatternMatcher.class.getName());

	private static final String OPERAND = "(-?\\d+(?:\\.\\d+)?|[A-Za-z_]\\w*|\"[^\"]*\")";
	private static final String CONDITION = OPERAND + "\\s+(.+?)\\s+" + OPERAND;
	private static final String NAME = "(\\S+)";
	private static final String LOOP_NAME = "([A-Za-z_]\\w*)\\b";

	private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+and\\s+", Pattern.CASE_INSENSITIVE);
	private static final Pattern DICT_ENTRY = Pattern.compile("^(\"[^\"]*\"|[^\\s:=]+)\\s*(?::|=|\\s)\\s*(.+)$");

	private final List<Rule> rules;
	private final List<Rule> arithmeticPhrases;
	private final List<Pattern> conditionShapes;

	public PatternMatcher() {
		this.arithmeticPhrases = arithmeticPhrases();
		this.conditionShapes = List.of(
				Pattern.compile("^if\\s+" + CONDITION + "\\s+then\\s+.+$", Pattern.CASE_INSENSITIVE),
				Pattern.compile("^when\\s+" + CONDITION + "\\s+(?:do|then)\\s+.+$", Pattern.CASE_INSENSITIVE));
		this.rules = buildRules();
	}

	/**
	 * @throws TranslationException {@link ErrorKind#AMBIGUOUS_OPERATOR} when the
	 *                              statement is shaped like a comparison but uses
	 *                              an operator word with no mapping,
	 *                              {@link ErrorKind#UNRECOGNIZED_STATEMENT} when
	 *                              no rule applies
	 */
	public Instruction match(String statement) throws TranslationException {
		String s = statement.strip();
		for (Rule rule : rules) {
			Instruction instruction = rule.apply(s);
			if (instruction != null) {
				LOGGER.log(Level.FINE, "''{0}'' matched rule {1}", new Object[] { s, rule.name() });
				return instruction;
			}
		}

		String operator = unknownComparator(s);
		if (operator != null) {
			throw new TranslationException(ErrorKind.AMBIGUOUS_OPERATOR, statement,
					"Unknown comparison operator '" + operator + "'; use 'greater than', 'less than' or 'equals'");
		}
		throw new TranslationException(ErrorKind.UNRECOGNIZED_STATEMENT, statement,
				"Unrecognized statement: " + statement + ". Try for example " + hints());
	}

	private static String hints() {
		StringJoiner joiner = new StringJoiner(", ");
		for (List<String> examples : SupportedPatterns.examples().values()) {
			joiner.add("'" + examples.get(0) + "'");
		}
		return joiner.toString();
	}

	/**
	 * Whether some rule accepts the statement. Never throws.
	 */
	public boolean recognizes(String statement) {
		String s = statement.strip();
		for (Rule rule : rules) {
			if (rule.apply(s) != null) {
				return true;
			}
		}
		return false;
	}

	private String unknownComparator(String s) {
		for (Pattern shape : conditionShapes) {
			Matcher m = shape.matcher(s);
			if (m.matches() && Keywords.comparator(m.group(2)) == null) {
				return m.group(2);
			}
		}
		return null;
	}

	private List<Rule> buildRules() {
		List<Rule> table = new ArrayList<>();

		// 1. conditionals with else
		table.add(Rule.of("if-then-else",
				"^if\\s+" + CONDITION + "\\s+then\\s+(.+?)\\s+else\\s+(.+)$", PatternMatcher::conditional));
		table.add(Rule.of("when-do-else",
				"^when\\s+" + CONDITION + "\\s+(?:do|then)\\s+(.+?)\\s+else\\s+(.+)$", PatternMatcher::conditional));

		// 2. conditionals without else
		table.add(Rule.of("if-then", "^if\\s+" + CONDITION + "\\s+then\\s+(.+)$", PatternMatcher::conditional));
		table.add(Rule.of("when-do", "^when\\s+" + CONDITION + "\\s+(?:do|then)\\s+(.+)$",
				PatternMatcher::conditional));

		// 3. arithmetic
		table.add(Rule.of("set-to-arithmetic", "^set\\s+" + NAME + "\\s+to\\s+(.+)$", this::arithmeticInto));
		table.addAll(arithmeticPhrases);

		// 4. assignment
		table.add(Rule.of("set-to", "^set\\s+" + NAME + "\\s+to\\s+(.+)$", m -> assignment(m.group(1), m.group(2))));
		table.add(Rule.of("create-variable", "^create\\s+variable\\s+" + NAME + "\\s+with\\s+value\\s+(.+)$",
				m -> assignment(m.group(1), m.group(2))));
		table.add(Rule.of("assign-to", "^assign\\s+(.+)\\s+to\\s+" + NAME + "$",
				m -> assignment(m.group(2), m.group(1))));

		// 5. collections
		table.add(Rule.of("create-list",
				"^create\\s+(?:an?\\s+)?(?:new\\s+)?list(?:\\s+(?:with|of|containing)\\s+(.+))?$",
				m -> list(m.group(1))));
		table.add(Rule.of("create-dict",
				"^create\\s+(?:an?\\s+)?(?:new\\s+)?(?:dict|dictionary)(?:\\s+(?:with|of|containing)\\s+(.+))?$",
				m -> dict(m.group(1))));
		table.add(Rule.of("add-to-list", "^add\\s+(.+?)\\s+to\\s+(?:the\\s+)?(?:list\\s+)?" + NAME + "$",
				PatternMatcher::append));

		// 6. loops
		table.add(Rule.of("repeat", "^repeat\\s+(\\d+)\\s+times?\\b\\s*[:,]?\\s*(.+)$",
				m -> Loop.repeat(new BigInteger(m.group(1)).toString(), ActionParser.parse(m.group(2)))));
		table.add(Rule.of("while", "^while\\s+" + OPERAND + "\\s+" + Keywords.comparatorPattern() + "\\s+" + OPERAND
				+ "(?:\\s*[:,]\\s*|\\s+)(?:do\\s+)?(.+)$", PatternMatcher::whileLoop));
		table.add(Rule.of("for-each", "^for\\s+each\\s+" + LOOP_NAME + "\\s+in\\s+" + LOOP_NAME + "\\s*[:,]?\\s*(.+)$",
				PatternMatcher::forEach));

		return List.copyOf(table);
	}

	private static List<Rule> arithmeticPhrases() {
		return List.of(
				Rule.of("add", "^add\\s+" + OPERAND + "\\s+and\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.ADD, m.group(1), m.group(2))),
				// operands swap: subtract A from B is B - A
				Rule.of("subtract", "^subtract\\s+" + OPERAND + "\\s+from\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.SUBTRACT, m.group(2), m.group(1))),
				Rule.of("multiply", "^multiply\\s+" + OPERAND + "\\s+(?:by|and)\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.MULTIPLY, m.group(1), m.group(2))),
				Rule.of("divide", "^divide\\s+" + OPERAND + "\\s+by\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.DIVIDE, m.group(1), m.group(2))),
				Rule.of("plus", "^(?:calculate\\s+)?" + OPERAND + "\\s+plus\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.ADD, m.group(1), m.group(2))),
				Rule.of("minus", "^(?:calculate\\s+)?" + OPERAND + "\\s+minus\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.SUBTRACT, m.group(1), m.group(2))),
				Rule.of("times", "^(?:calculate\\s+)?" + OPERAND + "\\s+times\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.MULTIPLY, m.group(1), m.group(2))),
				Rule.of("divided-by", "^(?:calculate\\s+)?" + OPERAND + "\\s+divided\\s+by\\s+" + OPERAND + "$",
						m -> arithmetic(ArithmeticOp.DIVIDE, m.group(1), m.group(2))));
	}

	private static Instruction conditional(Matcher m) {
		Comparator comparator = Keywords.comparator(m.group(2));
		if (comparator == null) {
			return null;
		}
		Operand lhs = Operand.of(m.group(1));
		Operand rhs = Operand.of(m.group(3));
		if (m.groupCount() >= 5 && m.group(5) != null) {
			return new Conditional(lhs, comparator, rhs, ActionParser.parse(m.group(4)),
					ActionParser.parse(m.group(5)));
		}
		return new Conditional(lhs, comparator, rhs, ActionParser.parse(m.group(4)));
	}

	private static Instruction arithmetic(ArithmeticOp op, String lhs, String rhs) {
		return new Arithmetic(op, Operand.of(lhs), Operand.of(rhs));
	}

	private Instruction arithmeticInto(Matcher m) {
		String destination = m.group(1);
		if (!Keywords.isIdentifier(destination)) {
			return null;
		}
		String phrase = m.group(2).strip();
		for (Rule rule : arithmeticPhrases) {
			Instruction instruction = rule.apply(phrase);
			if (instruction instanceof Arithmetic a) {
				return new Arithmetic(a.op(), a.lhs(), a.rhs(), destination);
			}
		}
		return null;
	}

	private static Instruction assignment(String name, String value) {
		if (!Keywords.isIdentifier(name)) {
			return null;
		}
		return new Assignment(name, Literal.of(value));
	}

	private static Instruction list(String items) {
		List<Element> elements = new ArrayList<>();
		for (String item : splitItems(items)) {
			elements.add(Element.of(Operand.of(item)));
		}
		return new CollectionLiteral(CollectionKind.LIST, elements);
	}

	private static Instruction dict(String entries) {
		List<Element> elements = new ArrayList<>();
		for (String entry : splitItems(entries)) {
			Matcher em = DICT_ENTRY.matcher(entry);
			if (!em.matches()) {
				return null;
			}
			elements.add(new Element(Operand.of(em.group(1)).text(), Operand.of(em.group(2))));
		}
		return new CollectionLiteral(CollectionKind.DICT, elements);
	}

	private static List<String> splitItems(String items) {
		List<String> out = new ArrayList<>();
		if (items == null) {
			return out;
		}
		for (String item : LIST_SEPARATOR.split(items.strip())) {
			if (!item.isBlank()) {
				out.add(item.strip());
			}
		}
		return out;
	}

	private static Instruction append(Matcher m) {
		String listName = m.group(2);
		if (!Keywords.isIdentifier(listName)) {
			return null;
		}
		return new ListAppend(Operand.of(m.group(1)), listName);
	}

	private static Instruction whileLoop(Matcher m) {
		Comparator comparator = Keywords.comparator(m.group(2));
		if (comparator == null) {
			return null;
		}
		return new WhileLoop(Operand.of(m.group(1)), comparator, Operand.of(m.group(3)),
				ActionParser.parse(m.group(4)));
	}

	private static Instruction forEach(Matcher m) {
		String variable = m.group(1);
		String collection = m.group(2);
		if (!Keywords.isIdentifier(variable) || !Keywords.isIdentifier(collection)) {
			return null;
		}
		return Loop.forEach(variable, collection, ActionParser.parse(m.group(3)));
	}
}
