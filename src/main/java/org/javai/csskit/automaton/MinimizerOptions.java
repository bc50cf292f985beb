package org.javai.csskit.automaton;

/**
 * Switches for the minimizers.
 *
 * @param removeUnreachableStates drop states not reachable from the initial state before refining
 * @param stampMetadata write each member's equivalence class back onto the state or node
 */
public record MinimizerOptions(boolean removeUnreachableStates, boolean stampMetadata) {

	public static MinimizerOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private boolean removeUnreachableStates = false;
		private boolean stampMetadata = true;

		private Builder() {
		}

		public Builder removeUnreachableStates(boolean removeUnreachableStates) {
			this.removeUnreachableStates = removeUnreachableStates;
			return this;
		}

		public Builder stampMetadata(boolean stampMetadata) {
			this.stampMetadata = stampMetadata;
			return this;
		}

		public MinimizerOptions build() {
			return new MinimizerOptions(removeUnreachableStates, stampMetadata);
		}
	}
}
