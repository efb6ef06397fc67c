package lite.trans.passes.sugar;

/**
 * One spelling of a sugar operation: the name as written, whether it is used as a
 * standalone call or as a member of its collection, and whether a parenthesised argument
 * list follows the name.
 */
public class ExpansionRule {
	private final String spelling;
	private final SugarOperation operation;
	private final CallShape shape;
	private final boolean call;

	public ExpansionRule(String spelling, SugarOperation operation, CallShape shape, boolean call) {
		if(shape == CallShape.STANDALONE && !call) {
			throw new IllegalArgumentException("a standalone rule must take an argument list: " + spelling);
		}
		this.spelling = spelling;
		this.operation = operation;
		this.shape = shape;
		this.call = call;
	}

	public static ExpansionRule standalone(String spelling, SugarOperation operation) {
		return new ExpansionRule(spelling, operation, CallShape.STANDALONE, true);
	}

	public static ExpansionRule member(String spelling, SugarOperation operation) {
		return new ExpansionRule(spelling, operation, CallShape.MEMBER, false);
	}

	public static ExpansionRule memberCall(String spelling, SugarOperation operation) {
		return new ExpansionRule(spelling, operation, CallShape.MEMBER, true);
	}

	/**
	 * @return the name as written, {@code !} included for negated spellings
	 */
	public String getSpelling() {
		return spelling;
	}

	public boolean isNegated() {
		return spelling.endsWith("!");
	}

	public SugarOperation getOperation() {
		return operation;
	}

	public CallShape getShape() {
		return shape;
	}

	public boolean takesArgumentList() {
		return call;
	}

	/**
	 * @param argumentCount number of arguments inside the parentheses, 0 for a member rule
	 * without an argument list
	 */
	public boolean acceptsArgumentCount(int argumentCount) {
		int operands = shape == CallShape.MEMBER ? argumentCount + 1 : argumentCount;
		return operation.acceptsOperandCount(operands);
	}

	@Override
	public String toString() {
		switch(shape) {
			case STANDALONE:
				return spelling + "(...)";
			case MEMBER:
				return call ? "_." + spelling + "(...)" : "_." + spelling;
			default:
				throw new IllegalStateException("unknown call shape " + shape);
		}
	}
}
