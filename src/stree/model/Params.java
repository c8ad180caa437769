package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * The parameter list of a method definition. Always printed in parentheses.
 *
 */
public class Params extends Node {
	private final List<Param> params;

	public Params(SourceLocation location, List<Param> params) {
		super(location);
		this.params = Collections.unmodifiableList(params);
	}

	public List<Param> getParams() {
		return params;
	}

	public boolean isEmpty() {
		return params.isEmpty();
	}

	@Override
	public String getType() {
		return "params";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.children("params", params);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			formatter.text("(");
			try (Formatter.Scope ignored1 = formatter.indent()) {
				formatter.softline();
				formatter.seplist(params, () -> {
					formatter.text(",");
					formatter.breakable();
				});
			}
			formatter.softline();
			formatter.text(")");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Params that = (Params) o;
		return Objects.equals(params, that.params);
	}

	@Override
	public int hashCode() {
		return Objects.hash(params);
	}
}
