package oblivious.client.structure;

import oblivious.utils.ORAMUtils;

import java.util.Arrays;

/**
 * Leaf currently assigned to every block id.
 */
public class PositionMap {
	private final int[] locations;

	public PositionMap(int size) {
		this.locations = new int[size];
		Arrays.fill(locations, ORAMUtils.DUMMY_LOCATION);
	}

	public int getLocation(int address) {
		if (address < 0 || address >= locations.length) {
			return ORAMUtils.DUMMY_LOCATION;
		}
		return locations[address];
	}

	public void update(int address, int location) {
		locations[address] = location;
	}

	public int size() {
		return locations.length;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < locations.length; i++) {
			sb.append("ADDR: ").append(i)
					.append(", L: ").append(locations[i]).append("\n");
		}
		return sb.toString();
	}
}
