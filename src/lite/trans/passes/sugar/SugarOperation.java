package lite.trans.passes.sugar;

import java.util.List;

import lite.trans.passes.scan.OperandScanner;

/**
 * The collection operations the dialect spells as sugar, each with its JavaScript expansion.
 *
 * Operands are unevaluated source text. For a member-style use the receiver is the first
 * operand, followed by the call arguments if any.
 */
public enum SugarOperation {
	SORT(1) {
		@Override
		public String expand(List<String> operands) {
			return "[..." + spread(operands.get(0)) + "].sort((a, b) => a - b)";
		}
	},
	REVERSE(1) {
		@Override
		public String expand(List<String> operands) {
			return "[..." + spread(operands.get(0)) + "].reverse()";
		}
	},
	UNIQUE(1) {
		@Override
		public String expand(List<String> operands) {
			return "[...new Set(" + spread(operands.get(0)) + ")]";
		}
	},
	SUM(1) {
		@Override
		public String expand(List<String> operands) {
			return receiver(operands.get(0)) + ".reduce((a, b) => a + b, 0)";
		}
	},
	MUL(1) {
		@Override
		public String expand(List<String> operands) {
			return receiver(operands.get(0)) + ".reduce((a, b) => a * b, 1)";
		}
	},
	MAX(1) {
		@Override
		public String expand(List<String> operands) {
			return "Math.max(..." + spread(operands.get(0)) + ")";
		}
	},
	MIN(1) {
		@Override
		public String expand(List<String> operands) {
			return "Math.min(..." + spread(operands.get(0)) + ")";
		}
	},
	LEN(1) {
		@Override
		public String expand(List<String> operands) {
			return receiver(operands.get(0)) + ".length";
		}
	},
	FILTER(2) {
		@Override
		public String expand(List<String> operands) {
			return keep(operands, "===");
		}

		@Override
		public boolean acceptsFunctionLiterals() {
			return false;
		}
	},
	FILTER_NOT(2) {
		@Override
		public String expand(List<String> operands) {
			return keep(operands, "!==");
		}

		@Override
		public boolean acceptsFunctionLiterals() {
			return false;
		}
	},
	COUNT(2) {
		@Override
		public String expand(List<String> operands) {
			return keep(operands, "===") + ".length";
		}

		@Override
		public boolean acceptsFunctionLiterals() {
			return false;
		}
	},
	COUNT_NOT(2) {
		@Override
		public String expand(List<String> operands) {
			return keep(operands, "!==") + ".length";
		}

		@Override
		public boolean acceptsFunctionLiterals() {
			return false;
		}
	},
	/**
	 * Half-open integer sequence from the first operand toward the second, descending when
	 * the start is the larger one. The optional third operand is the step, sign ignored.
	 */
	RANGE(2, 3) {
		@Override
		public String expand(List<String> operands) {
			String start = operands.get(0).trim();
			String end = operands.get(1).trim();
			if(operands.size() == 2) {
				return "((s, e) => Array.from({ length: Math.ceil(Math.abs(e - s)) }, (_, i) => s < e ? s + i : s - i))("
						+ start + ", " + end + ")";
			}
			String step = operands.get(2).trim();
			return "((s, e, k) => Array.from({ length: Math.ceil(Math.abs(e - s) / Math.abs(k)) }, "
					+ "(_, i) => s < e ? s + i * Math.abs(k) : s - i * Math.abs(k)))("
					+ start + ", " + end + ", " + step + ")";
		}
	};

	private final int minOperands;
	private final int maxOperands;

	SugarOperation(int operands) {
		this(operands, operands);
	}

	SugarOperation(int minOperands, int maxOperands) {
		this.minOperands = minOperands;
		this.maxOperands = maxOperands;
	}

	/**
	 * @param operands between {@link #getMinOperands()} and {@link #getMaxOperands()} texts
	 */
	public abstract String expand(List<String> operands);

	/**
	 * @return false if an arrow or function expression among the operands means the call is
	 * a native JavaScript call and not this operation
	 */
	public boolean acceptsFunctionLiterals() {
		return true;
	}

	public int getMinOperands() {
		return minOperands;
	}

	public int getMaxOperands() {
		return maxOperands;
	}

	public boolean acceptsOperandCount(int count) {
		return count >= minOperands && count <= maxOperands;
	}

	private static String spread(String operand) {
		return operand.trim();
	}

	private static String receiver(String operand) {
		return OperandScanner.asReceiver(operand);
	}

	private static String keep(List<String> operands, String comparison) {
		return receiver(operands.get(0)) + ".filter((__v) => __v " + comparison + " "
				+ receiver(operands.get(1)) + ")";
	}
}
