package oblivious.translation;

import java.util.Objects;

/**
 * Position of a parameter element: the ORAM block holding it and the byte offset inside that block.
 */
public final class BlockAddress {
	private final int block;
	private final int offset;

	public BlockAddress(int block, int offset) {
		this.block = block;
		this.offset = offset;
	}

	public int getBlock() {
		return block;
	}

	public int getOffset() {
		return offset;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof BlockAddress)) return false;
		BlockAddress that = (BlockAddress) o;
		return block == that.block && offset == that.offset;
	}

	@Override
	public int hashCode() {
		return Objects.hash(block, offset);
	}

	@Override
	public String toString() {
		return "(" + block + ", " + offset + ")";
	}
}
