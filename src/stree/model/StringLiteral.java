package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

/**
 * 
 * A string literal, quotes included. Printed with the preferred quote character when the
 * change cannot alter its value.
 *
 */
public class StringLiteral extends Leaf {

	public StringLiteral(SourceLocation location, String value) {
		super(location, value);
	}

	@Override
	public String getType() {
		return "string";
	}

	@Override
	public void format(Formatter formatter) {
		formatter.text(normalize(getValue(), formatter.getConfig().isPreferSingleQuotes()));
	}

	static String normalize(String literal, boolean preferSingleQuotes) {
		char quote = literal.charAt(0);
		String content = literal.substring(1, literal.length() - 1);
		if (content.indexOf('\\') != -1) {
			return literal;
		}
		if (quote == '\'' && !preferSingleQuotes) {
			// interpolation and escapes only exist between double quotes
			if (content.indexOf('"') != -1 || content.indexOf('#') != -1) {
				return literal;
			}
			return '"' + content + '"';
		}
		if (quote == '"' && preferSingleQuotes) {
			if (content.indexOf('\'') != -1 || content.indexOf('#') != -1) {
				return literal;
			}
			return '\'' + content + '\'';
		}
		return literal;
	}
}
