package lite.trans.passes.sugar;

public enum CallShape {
	/** {@code name(collection, ...)} */
	STANDALONE,
	/** {@code collection.name} or {@code collection.name(...)} */
	MEMBER
}
