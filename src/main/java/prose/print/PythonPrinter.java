package prose.print;

import prose.ast.Action;
import prose.ast.Arithmetic;
import prose.ast.Assignment;
import prose.ast.CollectionKind;
import prose.ast.CollectionLiteral;
import prose.ast.CollectionLiteral.Element;
import prose.ast.Comparator;
import prose.ast.Conditional;
import prose.ast.Instruction;
import prose.ast.ListAppend;
import prose.ast.Loop;
import prose.ast.LoopKind;
import prose.ast.Operand;
import prose.ast.Print;
import prose.ast.RawAction;
import prose.ast.WhileLoop;
import prose.resolve.ActionResolver;
import prose.resolve.SymbolLookup;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders instructions as Python source.
 *
 * Block bodies are indented one level (four spaces) below their header.
 * Comparison and arithmetic operands are emitted as written; action and
 * collection tokens are resolved against {@code symbols} at the time of the
 * call, so instructions must be printed in statement order.
 */
public final class PythonPrinter {
	public static final String NL = "\n";
	private static final String INDENT = "    ";
	private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1f\\x7f\\u0085\\u2028\\u2029]");

	public String print(Instruction instruction, SymbolLookup symbols) {
		List<String> lines = new ArrayList<>();
		printInstruction(instruction, symbols, 0, lines);
		return String.join(NL, lines);
	}

	private void printInstruction(Instruction instruction, SymbolLookup symbols, int depth, List<String> out) {
		String indent = INDENT.repeat(depth);
		if (instruction instanceof Assignment a) {
			out.add(indent + a.name() + " = " + ActionResolver.literal(a.value()));
		} else if (instruction instanceof Arithmetic a) {
			out.add(indent + a.destination() + " = "
					+ ActionResolver.operand(a.lhs()) + " " + a.op().symbol() + " "
					+ ActionResolver.operand(a.rhs()));
		} else if (instruction instanceof Conditional c) {
			out.add(indent + "if " + condition(c.lhs(), c.comparator(), c.rhs()) + ":");
			out.add(indent + INDENT + printAction(c.thenAction(), symbols));
			if (c.elseAction() != null) {
				out.add(indent + "else:");
				out.add(indent + INDENT + printAction(c.elseAction(), symbols));
			}
		} else if (instruction instanceof Loop l) {
			printLoop(l, symbols, indent, out);
		} else if (instruction instanceof WhileLoop w) {
			out.add(indent + "while " + condition(w.lhs(), w.comparator(), w.rhs()) + ":");
			out.add(indent + INDENT + printAction(w.body(), symbols));
		} else if (instruction instanceof CollectionLiteral c) {
			out.add(indent + c.kind().variableName() + " = " + printCollection(c, symbols));
		} else if (instruction instanceof ListAppend a) {
			out.add(indent + a.listName() + ".append(" + ActionResolver.resolve(a.item(), symbols) + ")");
		} else {
			throw new IllegalArgumentException("Cannot print " + instruction);
		}
	}

	private static String condition(Operand lhs, Comparator comparator, Operand rhs) {
		return ActionResolver.operand(lhs) + " " + comparator.symbol() + " " + ActionResolver.operand(rhs);
	}

	private void printLoop(Loop loop, SymbolLookup symbols, String indent, List<String> out) {
		if (loop.kind() == LoopKind.REPEAT_N) {
			out.add(indent + "for " + Loop.DISCARD + " in range(" + loop.countOrCollection() + "):");
			out.add(indent + INDENT + printAction(loop.body(), symbols));
			return;
		}
		out.add(indent + "for " + loop.variable() + " in " + loop.countOrCollection() + ":");
		out.add(indent + INDENT + printAction(loop.body(), symbols.with(loop.variable())));
	}

	private String printCollection(CollectionLiteral collection, SymbolLookup symbols) {
		boolean keyed = collection.kind() == CollectionKind.DICT;
		StringJoiner items = keyed ? new StringJoiner(", ", "{", "}") : new StringJoiner(", ", "[", "]");
		for (Element e : collection.elements()) {
			String value = ActionResolver.resolve(e.value(), symbols);
			if (e.isKeyed()) {
				items.add(ActionResolver.quote(e.key()) + ": " + value);
			} else {
				items.add(value);
			}
		}
		return items.toString();
	}

	String printAction(Action action, SymbolLookup symbols) {
		if (action instanceof Print p) {
			return "print(" + ActionResolver.resolve(p.token(), symbols) + ")";
		}
		RawAction raw = (RawAction) action;
		if (raw.isEmpty()) {
			return "pass";
		}
		return "pass  # " + CONTROL.matcher(raw.text()).replaceAll(" ");
	}
}
