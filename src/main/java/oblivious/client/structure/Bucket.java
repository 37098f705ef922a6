package oblivious.client.structure;

import oblivious.utils.ORAMContext;
import oblivious.utils.RawCustomExternalizable;

import java.util.Arrays;

public class Bucket implements RawCustomExternalizable {
	private final Block[] blocks;
	private int location;

	public Bucket(ORAMContext oramContext) {
		this.blocks = new Block[oramContext.getBucketSize()];
		for (int i = 0; i < blocks.length; i++) {
			blocks[i] = new Block(oramContext.getBlockSize(), oramContext.getIdSize());
		}
	}

	public Block getBlock(int index) {
		return blocks[index];
	}

	public Block[] getBlocks() {
		return blocks;
	}

	public int getBucketSize() {
		return blocks.length;
	}

	public int getLocation() {
		return location;
	}

	public void setLocation(int location) {
		this.location = location;
	}

	public void clear() {
		for (Block block : blocks) {
			block.markDummy();
		}
	}

	public int countRealBlocks() {
		int count = 0;
		for (Block block : blocks) {
			if (!block.isDummy())
				count++;
		}
		return count;
	}

	@Override
	public int writeExternal(byte[] output, int startOffset) {
		int offset = startOffset;
		for (Block block : blocks) {
			offset = block.writeExternal(output, offset);
		}
		return offset;
	}

	@Override
	public int readExternal(byte[] input, int startOffset) {
		int offset = startOffset;
		for (Block block : blocks) {
			offset = block.readExternal(input, offset);
		}
		return offset;
	}

	@Override
	public int getSerializedSize() {
		return blocks.length * blocks[0].getSerializedSize();
	}

	@Override
	public String toString() {
		return Arrays.toString(blocks);
	}
}
