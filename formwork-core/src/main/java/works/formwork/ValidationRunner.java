package works.formwork;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each node's {@link RuleChecker} on its values, depth first,
 * leaving each node's own report in {@link FormNode#errors()}.
 */
final class ValidationRunner {
	private ValidationRunner() { }

	static ErrorReport validate(FormNode node) {
		ErrorReport.Builder report = ErrorReport.builder()
			.addAll(node.definition().rules().check(node.values()));
		for (PropertyDescriptor p : node.definition().properties()) {
			switch (p.kind()) {
				case SCALAR -> { }
				case NESTED -> {
					FormNode child = node.child(p.name());
					if (child != null) {
						report.addAll(p.name(), validate(child));
					}
				}
				case NESTED_COLLECTION -> {
					List<FormNode> children = node.children(p.name());
					for (int i = 0; i < children.size(); i++) {
						String elementPath = p.name() + "[" + i + "]";
						FormNode child = children.get(i);
						if (child.isStale()) {
							report.add(elementPath, STALE_MESSAGE);
						} else {
							report.addAll(elementPath, validate(child));
						}
					}
				}
			}
		}
		ErrorReport result = report.build();
		node.errors = result;
		if (!result.isEmpty()) {
			LOGGER.debug("Validation of {} found errors at {}", node, result.paths());
		}
		return result;
	}

	static final String STALE_MESSAGE = "is no longer present in the input";
	private static final Logger LOGGER = LoggerFactory.getLogger(ValidationRunner.class);
}
