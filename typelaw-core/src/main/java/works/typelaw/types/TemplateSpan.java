package works.typelaw.types;

import static java.util.Objects.requireNonNull;

public sealed interface TemplateSpan {
	record Text(String text) implements TemplateSpan {
		public Text {
			requireNonNull(text);
		}
	}

	record Placeholder(TypeId type) implements TemplateSpan {
		public Placeholder {
			requireNonNull(type);
		}
	}

	static TemplateSpan text(String text) {
		return new Text(text);
	}

	static TemplateSpan placeholder(TypeId type) {
		return new Placeholder(type);
	}
}
