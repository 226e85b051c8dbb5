package works.jsonpack.value;

public enum NullValue implements Value {
	NULL;

	@Override
	public String kind() {
		return "null";
	}

	@Override
	public String toString() {
		return "null";
	}
}
