package lite.errors;

import lite.trans.WhileRunningPass;
import lite.trans.WhileTranspilingFile;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileTranspilingFile whileTranspilingFile) throws E;
	public abstract T visit(WhileRunningPass whileRunningPass) throws E;

}
