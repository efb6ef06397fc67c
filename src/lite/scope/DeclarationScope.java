package lite.scope;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The identifiers that already received a declaration keyword in the file being
 * transpiled.
 *
 * The scope is flat: one set for the whole file, with no notion of blocks or shadowing.
 * An identifier first assigned inside a function is therefore considered declared for
 * the rest of the file, including code outside that function.
 */
public class DeclarationScope {

	private final Set<String> declared = new LinkedHashSet<>();

	public boolean isDeclared(String name) {
		return declared.contains(name);
	}

	/**
	 * @return true if the name was not declared before
	 */
	public boolean declare(String name) {
		return declared.add(name);
	}

	/**
	 * @return the declared names, in declaration order
	 */
	public Set<String> getDeclared() {
		return Collections.unmodifiableSet(declared);
	}
}
