package stree.dump;

import org.json.JSONArray;
import org.json.JSONObject;
import stree.model.Comment;
import stree.model.FieldVisitor;
import stree.model.Node;
import stree.model.Program;
import stree.util.SourceLocation;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Converts a syntax tree to JSON: each node becomes an object holding its type, its location and
 * its fields by name. A program also lists its comments.
 */
public class JsonDumper {
	private final Set<Node> active = Collections.newSetFromMap(new IdentityHashMap<>());

	public static String dump(Node root) {
		return new JsonDumper().toJson(root).toString(2);
	}

	public JSONObject toJson(Node node) {
		JSONObject result = new JSONObject();
		result.put("type", node.getType());
		if (!active.add(node)) {
			result.put("cycle", true);
			return result;
		}
		try {
			result.put("location", locationToJson(node.getLocation()));
			node.accept(new FieldVisitor() {
				@Override
				public void field(String name, Object value) {
					result.put(name, value == null ? JSONObject.NULL : value.toString());
				}

				@Override
				public void child(String name, Node child) {
					result.put(name, child == null ? JSONObject.NULL : toJson(child));
				}

				@Override
				public void children(String name, List<? extends Node> children) {
					JSONArray array = new JSONArray();
					for (Node child : children) {
						array.put(toJson(child));
					}
					result.put(name, array);
				}
			});
			if (node instanceof Program) {
				JSONArray comments = new JSONArray();
				for (Comment comment : ((Program) node).getComments()) {
					JSONObject c = new JSONObject();
					c.put("value", comment.getValue());
					c.put("inline", comment.isInline());
					c.put("location", locationToJson(comment.getLocation()));
					comments.put(c);
				}
				result.put("comments", comments);
			}
			return result;
		} finally {
			active.remove(node);
		}
	}

	private static JSONObject locationToJson(SourceLocation location) {
		JSONObject result = new JSONObject();
		if (location.isUnknown()) {
			return result;
		}
		result.put("start_line", location.getStartLine());
		result.put("start_column", location.getStartColumn());
		result.put("end_line", location.getEndLine());
		result.put("end_column", location.getEndColumn());
		return result;
	}
}
