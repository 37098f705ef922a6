package oblivious.utils;

public interface RawCustomExternalizable {

	/**
	 * Serializes the object into the output byte array.
	 * @param output Output byte array
	 * @param startOffset Start offset in the output byte array
	 * @return The offset right after the last byte written
	 */
	int writeExternal(byte[] output, int startOffset);

	/**
	 * Deserializes the object from the input byte array.
	 * @param input Input byte array
	 * @param startOffset Start offset in the input byte array
	 * @return The offset right after the last byte read
	 */
	int readExternal(byte[] input, int startOffset);

	int getSerializedSize();
}
