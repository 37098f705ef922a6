package oblivious.client.structure;

import oblivious.utils.ORAMUtils;
import oblivious.utils.RawCustomExternalizable;

import java.util.Arrays;

/**
 * One physical slot of a bucket: a block id followed by the block payload. Serialized as {@code idSize}
 * little-endian id bytes and {@code blockSize} payload bytes.
 */
public class Block implements RawCustomExternalizable {
	private final int blockSize;
	private final int idSize;
	private final long invalidId;
	private long address;
	private final byte[] content;

	public Block(int blockSize, int idSize) {
		this.blockSize = blockSize;
		this.idSize = idSize;
		this.invalidId = ORAMUtils.computeInvalidId(idSize);
		this.address = invalidId;
		this.content = new byte[blockSize];
	}

	public long getAddress() {
		return address;
	}

	public void setAddress(long address) {
		this.address = address;
	}

	public boolean isDummy() {
		return address == invalidId;
	}

	public void markDummy() {
		address = invalidId;
		Arrays.fill(content, (byte) 0);
	}

	/**
	 * Live payload buffer.
	 */
	public byte[] getContent() {
		return content;
	}

	public void setContent(byte[] newContent) {
		System.arraycopy(newContent, 0, content, 0, blockSize);
	}

	@Override
	public int writeExternal(byte[] output, int startOffset) {
		int offset = startOffset;
		ORAMUtils.serializeLittleEndian(address, idSize, output, offset);
		offset += idSize;
		System.arraycopy(content, 0, output, offset, blockSize);
		return offset + blockSize;
	}

	@Override
	public int readExternal(byte[] input, int startOffset) {
		int offset = startOffset;
		address = ORAMUtils.deserializeLittleEndian(input, offset, idSize);
		offset += idSize;
		System.arraycopy(input, offset, content, 0, blockSize);
		return offset + blockSize;
	}

	@Override
	public int getSerializedSize() {
		return idSize + blockSize;
	}

	@Override
	public String toString() {
		return isDummy() ? "B(DUMMY)" : "B(ADDR: " + address + ")";
	}
}
