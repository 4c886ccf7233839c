package prose.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolTableTest {
	@Test
	void redeclarationIsHarmless() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("x");
		symbols.declare("y");
		symbols.declare("x");
		assertEquals(2, symbols.size());
		assertEquals(List.of("x", "y"), List.copyOf(symbols.names()));
	}

	@Test
	void blankNamesAreRejected() {
		SymbolTable symbols = new SymbolTable();
		assertThrows(IllegalArgumentException.class, () -> symbols.declare(" "));
		assertThrows(IllegalArgumentException.class, () -> symbols.declare(null));
	}

	@Test
	void copyIsIndependent() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("x");
		SymbolTable copy = symbols.copy();
		copy.declare("y");
		assertTrue(copy.isKnown("x"));
		assertFalse(symbols.isKnown("y"));

		symbols.declareAll(copy.names());
		assertTrue(symbols.isKnown("y"));
	}

	@Test
	void namesViewIsReadOnly() {
		SymbolTable symbols = new SymbolTable();
		symbols.declare("x");
		assertThrows(UnsupportedOperationException.class, () -> symbols.names().add("y"));
	}
}
