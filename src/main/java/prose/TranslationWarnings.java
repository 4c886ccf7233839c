package prose;

import prose.ast.Arithmetic;
import prose.ast.ArithmeticOp;
import prose.ast.Conditional;
import prose.ast.Instruction;
import prose.ast.ListAppend;
import prose.ast.Literal;
import prose.ast.Loop;
import prose.ast.LoopKind;
import prose.ast.Operand;
import prose.ast.WhileLoop;
import prose.resolve.ActionResolver;
import prose.resolve.SymbolLookup;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runtime risks visible in a single instruction. Warnings never fail a
 * translation.
 */
final class TranslationWarnings {
	static final BigInteger LARGE_RANGE = BigInteger.valueOf(10_000);

	private TranslationWarnings() {
	}

	static List<String> check(Instruction instruction) {
		List<String> warnings = new ArrayList<>();
		if (instruction instanceof Arithmetic a && a.op() == ArithmeticOp.DIVIDE && isZero(a.rhs().text())
				&& !a.rhs().quoted()) {
			warnings.add("[MEDIUM] Division by zero detected in '" + a.destination() + "'");
		}
		if (instruction instanceof Loop l && l.kind() == LoopKind.REPEAT_N
				&& new BigInteger(l.countOrCollection()).compareTo(LARGE_RANGE) > 0) {
			warnings.add("[MEDIUM] Large range operation detected: range(" + l.countOrCollection() + ")");
		}
		return warnings;
	}

	/**
	 * Names the instruction reads that nothing has assigned yet.
	 */
	static List<String> undefinedNames(Instruction instruction, SymbolLookup symbols) {
		List<String> names = new ArrayList<>();
		if (instruction instanceof Arithmetic a) {
			addUnknown(a.lhs(), symbols, names);
			addUnknown(a.rhs(), symbols, names);
		} else if (instruction instanceof Conditional c) {
			addUnknown(c.lhs(), symbols, names);
			addUnknown(c.rhs(), symbols, names);
		} else if (instruction instanceof WhileLoop w) {
			addUnknown(w.lhs(), symbols, names);
			addUnknown(w.rhs(), symbols, names);
		} else if (instruction instanceof Loop l && l.kind() == LoopKind.FOR_EACH
				&& !symbols.isKnown(l.countOrCollection())) {
			names.add(l.countOrCollection());
		} else if (instruction instanceof ListAppend a && !symbols.isKnown(a.listName())) {
			names.add(a.listName());
		}
		return names;
	}

	static String undefinedSummary(Collection<String> names) {
		return "[HIGH] Potentially undefined variables: " + String.join(", ", names);
	}

	static String batchSummary(int statements) {
		return "[INFO] Processed " + statements + " statements";
	}

	private static void addUnknown(Operand operand, SymbolLookup symbols, List<String> names) {
		if (ActionResolver.isReference(operand) && !symbols.isKnown(operand.text())) {
			names.add(operand.text());
		}
	}

	private static boolean isZero(String text) {
		return Literal.isNumber(text) && new BigDecimal(text).signum() == 0;
	}
}
