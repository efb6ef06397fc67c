package lite.lexer;

public enum LiteTokenType {
	// a complete string literal, including template literals without substitutions
	STRING,
	// the pieces of a template literal around its ${...} substitutions: `a${, }b${ and }c`
	TEMPLATE_HEAD,
	TEMPLATE_MIDDLE,
	TEMPLATE_TAIL,
	IDENT,
	NUMBER,
	// operators, brackets and other punctuation
	BUILTIN,
}
