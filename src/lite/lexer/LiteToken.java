package lite.lexer;

import lite.util.SourceLocatable;
import lite.util.SourceLocation;

public class LiteToken extends SourceLocatable {

	String value;
	LiteTokenType type;
	SourceLocation location;
	boolean terminated;

	public LiteToken(String value, LiteTokenType type, SourceLocation location) {
		this(value, type, location, true);
	}

	public LiteToken(String value, LiteTokenType type, SourceLocation location, boolean terminated) {
		this.value = value;
		this.type = type;
		this.location = location;
		this.terminated = terminated;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the exact source text of the token, quotes included for strings
	 */
	public String getValue() {
		return value;
	}

	public LiteTokenType getType() {
		return type;
	}

	/**
	 * @return false for a string literal that reached the end of its line (or of the buffer,
	 * for template literals) without its closing quote
	 */
	public boolean isTerminated() {
		return terminated;
	}

	public int getStartOffset() {
		return location.getStartOffset();
	}

	public int getEndOffset() {
		return location.getEndOffset();
	}

	public boolean is(LiteTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	public boolean isBuiltin(String value) {
		return is(LiteTokenType.BUILTIN, value);
	}

	public boolean isIdent(String value) {
		return is(LiteTokenType.IDENT, value);
	}

	@Override
	public String toString() {
		return "LiteToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((location == null) ? 0 : location.hashCode());
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
		result = prime * result + (terminated ? 1 : 0);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LiteToken other = (LiteToken) obj;
		if (location == null) {
			if (other.location != null)
				return false;
		} else if (!location.equals(other.location))
			return false;
		if (type != other.type)
			return false;
		if (terminated != other.terminated)
			return false;
		if (value == null) {
			if (other.value != null)
				return false;
		} else if (!value.equals(other.value))
			return false;
		return true;
	}

}
