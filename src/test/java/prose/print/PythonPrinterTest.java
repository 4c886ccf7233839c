package prose.print;

import org.junit.jupiter.api.Test;
import prose.ast.Arithmetic;
import prose.ast.ArithmeticOp;
import prose.ast.Assignment;
import prose.ast.CollectionKind;
import prose.ast.CollectionLiteral;
import prose.ast.CollectionLiteral.Element;
import prose.ast.Comparator;
import prose.ast.Conditional;
import prose.ast.ListAppend;
import prose.ast.Literal;
import prose.ast.Loop;
import prose.ast.Operand;
import prose.ast.Print;
import prose.ast.RawAction;
import prose.ast.WhileLoop;
import prose.resolve.SymbolTable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PythonPrinterTest {
	private final PythonPrinter printer = new PythonPrinter();

	@Test
	void printsAssignments() {
		SymbolTable symbols = new SymbolTable();
		assertEquals("age = 25", printer.print(new Assignment("age", Literal.of("25")), symbols));
		assertEquals("name = \"John\"", printer.print(new Assignment("name", Literal.of("John")), symbols));
	}

	@Test
	void printsArithmeticIntoDestination() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("price");
		assertEquals("result = 20 - 5",
				printer.print(new Arithmetic(ArithmeticOp.SUBTRACT, Operand.of("20"), Operand.of("5")), symbols));
		assertEquals("total = price * 2", printer.print(
				new Arithmetic(ArithmeticOp.MULTIPLY, Operand.of("price"), Operand.of("2"), "total"), symbols));
	}

	@Test
	void printsConditionalBlocks() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("age");
		Conditional conditional = new Conditional(Operand.of("age"), Comparator.GT, Operand.of("18"),
				new Print(Operand.of("adult")), new Print(Operand.of("minor")));
		assertEquals("if age > 18:\n    print(\"adult\")\nelse:\n    print(\"minor\")",
				printer.print(conditional, symbols));
	}

	@Test
	void rawActionsBecomeCommentedPass() {
		SymbolTable symbols = new SymbolTable();
		Conditional conditional = new Conditional(Operand.of("x"), Comparator.EQ, Operand.of("1"),
				new RawAction("stop everything"));
		assertEquals("if x == 1:\n    pass  # stop everything", printer.print(conditional, symbols));
		assertEquals("pass", printer.printAction(RawAction.EMPTY, symbols));
		assertEquals("pass  # beep now", printer.printAction(new RawAction("beep\u0000now"), symbols));
	}

	@Test
	void comparisonAndArithmeticOperandsAreReferencesEvenWhenUndeclared() {
		SymbolTable symbols = new SymbolTable();
		assertEquals("result = price * 2",
				printer.print(new Arithmetic(ArithmeticOp.MULTIPLY, Operand.of("price"), Operand.of("2")), symbols));
		Conditional conditional = new Conditional(Operand.of("name"), Comparator.EQ, Operand.of("\"Ann\""),
				new Print(Operand.of("name")));
		assertEquals("if name == \"Ann\":\n    print(\"name\")", printer.print(conditional, symbols));
	}

	@Test
	void printsWhileLoop() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("x");
		WhileLoop loop = new WhileLoop(Operand.of("x"), Comparator.LT, Operand.of("10"), new Print(Operand.of("x")));
		assertEquals("while x < 10:\n    print(x)", printer.print(loop, symbols));
	}

	@Test
	void printsLoops() {
		SymbolTable symbols = new SymbolTable();
		assertEquals("for _ in range(3):\n    print(\"hi\")",
				printer.print(Loop.repeat("3", new Print(Operand.of("hi"))), symbols));
		assertEquals("for n in numbers:\n    print(n)",
				printer.print(Loop.forEach("n", "numbers", new Print(Operand.of("n"))), symbols));
	}

	@Test
	void printsCollections() {
		SymbolTable symbols = new SymbolTable();
		CollectionLiteral list = new CollectionLiteral(CollectionKind.LIST,
				List.of(Element.of(Operand.of("1")), Element.of(Operand.of("two"))));
		assertEquals("new_list = [1, \"two\"]", printer.print(list, symbols));

		CollectionLiteral dict = new CollectionLiteral(CollectionKind.DICT,
				List.of(new Element("name", Operand.of("John")), new Element("age", Operand.of("25"))));
		assertEquals("new_dict = {\"name\": \"John\", \"age\": 25}", printer.print(dict, symbols));

		assertEquals("new_list = []", printer.print(new CollectionLiteral(CollectionKind.LIST, List.of()), symbols));
	}

	@Test
	void printsAppend() {
		SymbolTable symbols = new SymbolTable();
		assertEquals("numbers.append(4)", printer.print(new ListAppend(Operand.of("4"), "numbers"), symbols));
	}
}
