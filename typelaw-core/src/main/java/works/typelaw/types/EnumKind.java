package works.typelaw.types;

public enum EnumKind {
	NUMERIC,
	STRING,
	HETEROGENEOUS,
}
