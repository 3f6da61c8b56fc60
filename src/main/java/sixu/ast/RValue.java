package sixu.ast;

public sealed interface RValue permits Primitive, Variable, TemplateLiteral {
}
