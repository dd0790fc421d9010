package tacheck.scope;

import tacheck.model.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An ordered collection of symbols forming one lexical scope. Lookups that miss fall through to
 * the parent frame, if any.
 */
public class Frame {

	private final Frame parent;
	private final List<Symbol> symbols = new ArrayList<>();

	public Frame() {
		this(null);
	}

	public Frame(Frame parent) {
		this.parent = parent;
	}

	public Frame getParent() {
		return parent;
	}

	public Symbol add(String name, Type type) {
		return add(name, type, null);
	}

	public Symbol add(String name, Type type, Object data) {
		Symbol symbol = new Symbol(this, name, type, data);
		symbols.add(symbol);
		return symbol;
	}

	/**
	 * Adds an already declared symbol to this frame without changing its owner. Used for frames
	 * that alias symbols declared elsewhere, e.g. the parameters of a partial instance.
	 */
	public void add(Symbol symbol) {
		symbols.add(symbol);
	}

	public int getSize() {
		return symbols.size();
	}

	public Symbol get(int i) {
		return symbols.get(i);
	}

	public List<Symbol> getSymbols() {
		return Collections.unmodifiableList(symbols);
	}

	public boolean contains(Symbol symbol) {
		return symbols.contains(symbol);
	}

	public Optional<Symbol> lookup(String name) {
		for (Symbol symbol : symbols) {
			if (symbol.getName().equals(name)) {
				return Optional.of(symbol);
			}
		}
		if (parent != null) {
			return parent.lookup(name);
		}
		return Optional.empty();
	}

}
