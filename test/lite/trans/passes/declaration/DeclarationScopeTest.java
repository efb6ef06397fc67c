package lite.trans.passes.declaration;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import lite.lexer.TokenArena;
import lite.scope.DeclarationScope;

public class DeclarationScopeTest {

	@Test
	public void testScopeRecordsDeclarationsInOrder() {
		DeclarationScope scope = new DeclarationScope();
		new DeclarationInferencePass().perform("b = 1\na = 2\nb = 3\nobj.c = 4", scope);
		assertThat(scope.getDeclared().toArray(), is(Arrays.asList("b", "a").toArray()));
		assertTrue(scope.isDeclared("a"));
		assertFalse(scope.isDeclared("c"));
	}

	@Test
	public void testPredeclaredNamesAreNotDeclaredAgain() {
		DeclarationScope scope = new DeclarationScope();
		scope.declare("x");
		String result = new DeclarationInferencePass().perform("x = 1\ny = x", scope);
		assertThat(result, is("x = 1\nlet y = x"));
	}

	// every name receives the keyword at most once
	@Test
	public void testEachNameDeclaredOnce() {
		String source = "a = 1\nb = a\nf(x):\n  a = x\n  c = 2\nb = 3\nlet c = 4\nconst a = 5";
		String result = new DeclarationInferencePass().perform(source, new DeclarationScope());
		TokenArena arena = TokenArena.of(result);
		Map<String, Integer> counts = new HashMap<>();
		for(int i = 0; i + 1 < arena.size(); i++) {
			if(arena.isIdent(i, "let")) {
				counts.merge(arena.get(i + 1).getValue(), 1, Integer::sum);
			}
		}
		assertThat(counts.get("a"), is(1));
		assertThat(counts.get("b"), is(1));
		assertThat(counts.get("c"), is(1));
	}
}
