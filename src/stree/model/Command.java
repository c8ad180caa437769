package stree.model;

import stree.formatter.Formatter;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * A method call whose arguments are not parenthesised:
 * 
 * puts a, b
 * receiver.name a, b do |x| ... end
 * 
 * Arguments that do not fit continue on the next line, aligned under the first argument.
 *
 */
public class Command extends Node {
	private final Node receiver;
	private final String operator;
	private final String name;
	private final List<Node> arguments;
	private final Block block;

	public Command(SourceLocation location, Node receiver, String operator, String name, List<Node> arguments,
				   Block block) {
		super(location);
		this.receiver = receiver;
		this.operator = operator;
		this.name = name;
		this.arguments = Collections.unmodifiableList(arguments);
		this.block = block;
	}

	public Node getReceiver() {
		return receiver;
	}

	public String getOperator() {
		return operator;
	}

	public String getName() {
		return name;
	}

	public List<Node> getArguments() {
		return arguments;
	}

	public Block getBlock() {
		return block;
	}

	@Override
	public String getType() {
		return "command";
	}

	@Override
	public void accept(FieldVisitor v) {
		v.child("receiver", receiver);
		v.field("operator", operator);
		v.field("name", name);
		v.children("arguments", arguments);
		v.child("block", block);
	}

	@Override
	public void format(Formatter formatter) {
		try (Formatter.Scope ignored = formatter.group()) {
			if (receiver != null) {
				formatter.visit(receiver);
				formatter.text(operator);
			}
			formatter.text(name + " ");
			// only a command at the start of its line knows the column of its first argument
			try (Formatter.Scope ignored1 = receiver == null ? formatter.align(name.length() + 1) : formatter.indent()) {
				formatter.seplist(arguments, () -> {
					formatter.text(",");
					formatter.breakable();
				});
			}
		}
		if (block != null) {
			// braces would bind the block to the last argument instead
			formatter.visit(block, () -> block.format(formatter, !arguments.isEmpty()));
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Command command = (Command) o;
		return Objects.equals(receiver, command.receiver) &&
				Objects.equals(operator, command.operator) &&
				Objects.equals(name, command.name) &&
				Objects.equals(arguments, command.arguments) &&
				Objects.equals(block, command.block);
	}

	@Override
	public int hashCode() {
		return Objects.hash(receiver, operator, name, arguments, block);
	}
}
