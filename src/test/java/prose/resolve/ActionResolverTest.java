package prose.resolve;

import org.junit.jupiter.api.Test;
import prose.ast.Literal;
import prose.ast.Operand;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ActionResolverTest {
	@Test
	void unknownWordIsQuoted() {
		assertEquals("\"adult\"", ActionResolver.resolve(Operand.of("adult"), new SymbolTable()));
	}

	@Test
	void declaredNameIsBare() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("age");
		assertEquals("age", ActionResolver.resolve(Operand.of("age"), symbols));
	}

	@Test
	void quotedTokenStaysLiteralEvenWhenDeclared() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("age");
		assertEquals("\"age\"", ActionResolver.resolve(Operand.of("\"age\""), symbols));
	}

	@Test
	void numbersAndBooleans() {
		SymbolTable symbols = new SymbolTable();
		assertEquals("18", ActionResolver.resolve(Operand.of("18"), symbols));
		assertEquals("-2.5", ActionResolver.resolve(Operand.of("-2.5"), symbols));
		assertEquals("7", ActionResolver.resolve(Operand.of("007"), symbols));
		assertEquals("True", ActionResolver.resolve(Operand.of("TRUE"), symbols));
		assertEquals("False", ActionResolver.resolve(Operand.of("false"), symbols));
	}

	@Test
	void resolutionIsStableForAFixedTable() {
		SymbolTable symbols = new SymbolTable();
		String first = ActionResolver.resolve(Operand.of("hello world"), symbols);
		String second = ActionResolver.resolve(Operand.of("hello world"), symbols);
		assertEquals(first, second);
		assertEquals("\"hello world\"", first);
	}

	@Test
	void quotingEscapesSpecialCharacters() {
		assertEquals("\"say \\\"hi\\\"\"", ActionResolver.quote("say \"hi\""));
		assertEquals("\"a\\\\b\\nc\"", ActionResolver.quote("a\\b\nc"));
	}

	@Test
	void controlCharactersAreHexEscaped() {
		assertEquals("\"a\\x00b\\x1b\\x7f\"", ActionResolver.quote("a\u0000b\u001b\u007f"));
	}

	@Test
	void operandsOfExpressionsAreBareWords() {
		assertEquals("age", ActionResolver.operand(Operand.of("age")));
		assertEquals("\"age\"", ActionResolver.operand(Operand.of("\"age\"")));
		assertEquals("18", ActionResolver.operand(Operand.of("018")));
		assertEquals("True", ActionResolver.operand(Operand.of("true")));
		assertEquals("\"two words\"", ActionResolver.operand(Operand.of("two words")));
	}

	@Test
	void onlyBareWordsAreReferences() {
		assertTrue(ActionResolver.isReference(Operand.of("age")));
		assertFalse(ActionResolver.isReference(Operand.of("\"age\"")));
		assertFalse(ActionResolver.isReference(Operand.of("12")));
		assertFalse(ActionResolver.isReference(Operand.of("False")));
	}

	@Test
	void assignmentLiteralsIgnoreDeclaredNames() {
		assertEquals("\"John\"", ActionResolver.literal(Literal.of("John")));
		assertEquals("25", ActionResolver.literal(Literal.of("25")));
		assertEquals("True", ActionResolver.literal(Literal.of("true")));
		assertEquals("\"25\"", ActionResolver.literal(Literal.of("\"25\"")));
	}

	@Test
	void scopedLookupSeesLocalAndParent() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("total");
		SymbolLookup scoped = symbols.with("item");
		assertEquals("item", ActionResolver.resolve(Operand.of("item"), scoped));
		assertEquals("total", ActionResolver.resolve(Operand.of("total"), scoped));
		assertEquals("\"item\"", ActionResolver.resolve(Operand.of("item"), symbols));
	}
}
