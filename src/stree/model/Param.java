package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * One parameter of a method or block:
 * 
 * a, a = 1, *a, **a, a:, a: 1, &a
 *
 */
public class Param extends Node {

	public enum Kind {
		REQUIRED(""),
		OPTIONAL(""),
		REST("*"),
		KEYWORD_REST("**"),
		KEYWORD(""),
		BLOCK("&");

		private final String sigil;

		Kind(String sigil) {
			this.sigil = sigil;
		}

		public String getSigil() {
			return sigil;
		}
	}

	private final Kind kind;
	private final String name;
	private final Node defaultValue;

	public Param(SourceLocation location, Kind kind, String name, Node defaultValue) {
		super(location);
		this.kind = kind;
		this.name = name;
		this.defaultValue = defaultValue;
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public Node getDefaultValue() {
		return defaultValue;
	}

	@Override
	public String getType() {
		return "param";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.field("kind", kind);
		v.field("name", name);
		v.child("default", defaultValue);
	}

	@Override
	public void format(Formatter formatter) {
		switch (kind) {
			case KEYWORD:
				formatter.text(name + ":");
				if (defaultValue != null) {
					formatter.text(" ");
					formatter.visit(defaultValue);
				}
				break;
			case OPTIONAL:
				formatter.text(name + " = ");
				formatter.visit(defaultValue);
				break;
			default:
				formatter.text(kind.getSigil() + name);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Param param = (Param) o;
		return kind == param.kind &&
				Objects.equals(name, param.name) &&
				Objects.equals(defaultValue, param.defaultValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name, defaultValue);
	}
}
