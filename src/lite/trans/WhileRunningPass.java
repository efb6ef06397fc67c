package lite.trans;

import lite.errors.Context;
import lite.errors.ContextVisitor;

public class WhileRunningPass extends Context {

	private final String passName;

	public WhileRunningPass(String passName) {
		this.passName = passName;
	}

	public String getPassName() {
		return passName;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
