package lite.formatters;

import lite.errors.ContextVisitor;
import lite.trans.WhileRunningPass;
import lite.trans.WhileTranspilingFile;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileTranspilingFile whileTranspilingFile) throws IOException {
		out.write("while transpiling ");
		out.write(whileTranspilingFile.getFile().toString());
		return null;
	}

	@Override
	public Void visit(WhileRunningPass whileRunningPass) throws IOException {
		out.write("during ");
		out.write(whileRunningPass.getPassName());
		return null;
	}

}
