package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A method definition:
 * 
 * def name(params)
 *   body
 * end
 *
 */
public class Def extends Node {
	private final String name;
	private final Params params;
	private final Statements body;

	public Def(SourceLocation location, String name, Params params, Statements body) {
		super(location);
		this.name = name;
		this.params = params;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public Params getParams() {
		return params;
	}

	public Statements getBody() {
		return body;
	}

	@Override
	public String getType() {
		return "def";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("name", name);
		v.child("params", params);
		v.child("body", body);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.forcedGroup()) {
			formatter.text("def " + name);
			if (params != null && !params.isEmpty()) {
				formatter.visit(params);
			}
			Statements.formatBody(formatter, getLocation().getStartLine(), body);
			formatter.hardline();
			formatter.text("end");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Def def = (Def) o;
		return Objects.equals(name, def.name) &&
				Objects.equals(params, def.params) &&
				Objects.equals(body, def.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params, body);
	}
}
