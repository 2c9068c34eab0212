package works.typelaw.types;

import java.util.Locale;

public enum StringIntrinsicKind {
	UPPERCASE("Uppercase"),
	LOWERCASE("Lowercase"),
	CAPITALIZE("Capitalize"),
	UNCAPITALIZE("Uncapitalize");

	private final String displayName;

	StringIntrinsicKind(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}

	public String apply(String value) {
		return switch (this) {
			case UPPERCASE -> value.toUpperCase(Locale.ROOT);
			case LOWERCASE -> value.toLowerCase(Locale.ROOT);
			case CAPITALIZE -> value.isEmpty() ? value : value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
			case UNCAPITALIZE -> value.isEmpty() ? value : value.substring(0, 1).toLowerCase(Locale.ROOT) + value.substring(1);
		};
	}
}
