package org.beng183.sequences;

import java.util.Comparator;
import java.util.Map;

/**
 * Helpers for insertion-ordered count maps.
 */
final class Counts {

	private Counts() {
	}

	static <K> void increment(Map<K, Integer> map, K key) {
		Integer count = map.get(key);
		map.put(key, count == null ? 1 : count + 1);
	}

	static <K> int get(Map<K, Integer> map, K key) {
		Integer count = map.get(key);
		return count == null ? 0 : count;
	}

	static <K> Comparator<Map.Entry<K, Integer>> byCountDescending() {
		return new Comparator<Map.Entry<K, Integer>>() {
			@Override
			public int compare(Map.Entry<K, Integer> e1, Map.Entry<K, Integer> e2) {
				return Integer.compare(e2.getValue(), e1.getValue());
			}
		};
	}

}
