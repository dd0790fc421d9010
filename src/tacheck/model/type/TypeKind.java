package tacheck.model.type;

public enum TypeKind {
	UNKNOWN("unknown"),
	VOID("void"),
	CLOCK("clock"),
	INT("int"),
	BOOL("bool"),
	DOUBLE("double"),
	SCALAR("scalar"),
	LOCATION("location"),
	CHANNEL("chan"),
	COST("cost"),

	// produced by the type checker only
	RATE("rate"),
	INVARIANT("invariant"),
	INVARIANT_WR("invariant with rates"),
	GUARD("guard"),
	DIFF("clock difference"),
	CONSTRAINT("constraint"),
	FORMULA("formula"),
	FRACTION("fraction"),
	TIOGRAPH("process graph"),
	PROCESSVAR("process variable"),
	DOUBLEINVGUARD("double invariant or guard"),

	PROCESS("process"),
	INSTANCE("instance"),
	FUNCTION("function"),
	RANGE("range"),
	ARRAY("array"),
	RECORD("struct"),

	LABEL("typename"),
	URGENT("urgent"),
	COMMITTED("committed"),
	BROADCAST("broadcast"),
	HYBRID("hybrid"),
	CONSTANT("const"),
	SYSTEM_META("meta"),
	REF("ref");

	private final String text;

	TypeKind(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return whether {@link Type#is(TypeKind)} looks through a type of this kind to its first
	 * sub-type
	 */
	public boolean isTransparent() {
		switch (this) {
			case LABEL:
			case RANGE:
			case REF:
			case CONSTANT:
			case SYSTEM_META:
			case URGENT:
			case COMMITTED:
			case BROADCAST:
			case HYBRID:
				return true;
			default:
				return false;
		}
	}

	public boolean isPrefix() {
		switch (this) {
			case URGENT:
			case COMMITTED:
			case BROADCAST:
			case HYBRID:
			case CONSTANT:
			case SYSTEM_META:
			case REF:
				return true;
			default:
				return false;
		}
	}
}
