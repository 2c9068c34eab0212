package works.typelaw.env;

public enum DeclarationKind {
	TYPE_ALIAS,
	INTERFACE,
	CLASS,
	ENUM,
	FUNCTION,
	VARIABLE,
}
