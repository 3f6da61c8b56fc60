package sixu.ast;

public sealed interface Primitive extends RValue {
	record StringValue(String value) implements Primitive {
	}

	record IntegerValue(long value) implements Primitive {
	}

	record FloatValue(double value) implements Primitive {
	}

	record BooleanValue(boolean value) implements Primitive {
	}
}
