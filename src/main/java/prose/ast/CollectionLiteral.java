package prose.ast;

import java.util.List;

/**
 * create list with 1, 2, 3 / create dict with name John and age 25
 */
public record CollectionLiteral(CollectionKind kind, List<Element> elements) implements Instruction {
	public CollectionLiteral {
		elements = List.copyOf(elements);
	}

	/**
	 * A list element ({@code key} is null) or a dictionary entry.
	 */
	public record Element(String key, Operand value) {
		public static Element of(Operand value) {
			return new Element(null, value);
		}

		public boolean isKeyed() {
			return key != null;
		}
	}
}
