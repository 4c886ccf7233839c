package prose;

import prose.resolve.SymbolLookup;
import prose.resolve.SymbolTable;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the symbol table that successive translations share.
 *
 * A new session per input gives independent translations; keeping one session
 * lets later inputs see names declared by earlier ones. Translations on one
 * session are serialized.
 */
public final class TranslationSession {
	private final SymbolTable symbols = new SymbolTable();
	private final ReentrantLock lock = new ReentrantLock();

	/**
	 * Read-only view of the names committed so far. Only a translation on this
	 * session adds to it.
	 */
	public SymbolLookup symbols() {
		return name -> {
			lock.lock();
			try {
				return symbols.isKnown(name);
			} finally {
				lock.unlock();
			}
		};
	}

	SymbolTable table() {
		return symbols;
	}

	ReentrantLock lock() {
		return lock;
	}
}
