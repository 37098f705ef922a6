package oblivious.utils;

public enum Operation {
	READ,
	WRITE
}
