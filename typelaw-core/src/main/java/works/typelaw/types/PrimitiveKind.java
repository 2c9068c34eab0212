package works.typelaw.types;

public enum PrimitiveKind {
	ANY("any", TypeId.ANY),
	UNKNOWN("unknown", TypeId.UNKNOWN),
	NEVER("never", TypeId.NEVER),
	VOID("void", TypeId.VOID),
	NULL("null", TypeId.NULL),
	UNDEFINED("undefined", TypeId.UNDEFINED),
	BOOLEAN("boolean", TypeId.BOOLEAN),
	NUMBER("number", TypeId.NUMBER),
	STRING("string", TypeId.STRING),
	BIGINT("bigint", TypeId.BIGINT),
	SYMBOL("symbol", TypeId.SYMBOL),
	OBJECT("object", TypeId.OBJECT),
	UNRESOLVED("unresolved", TypeId.UNRESOLVED);

	private final String keyword;
	private final TypeId id;

	PrimitiveKind(String keyword, TypeId id) {
		this.keyword = keyword;
		this.id = id;
	}

	public String keyword() {
		return keyword;
	}

	public TypeId id() {
		return id;
	}
}
