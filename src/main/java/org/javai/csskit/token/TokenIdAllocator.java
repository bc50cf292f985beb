package org.javai.csskit.token;

/**
 * Hands out token ids for a single tokenizer run. Each run owns its own
 * allocator, so ids restart at zero and runs never share state.
 */
public final class TokenIdAllocator {

	private int next;

	public int nextId() {
		return next++;
	}

	public int allocated() {
		return next;
	}
}
