package lite.trans;

import java.nio.file.Path;

import lite.errors.Context;
import lite.errors.ContextVisitor;

public class WhileTranspilingFile extends Context {

	private final Path file;

	public WhileTranspilingFile(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
