package org.javai.csskit.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Automaton bookkeeping attached to a node by the minimizer.
 * The equivalence class stays {@code null} until a minimization run stamps it.
 */
public final class NodeMetadata {

	private Integer equivalenceClass;
	private String stateSignature;
	private boolean minimized;
	private final Map<String, Object> custom = new LinkedHashMap<>();

	public Integer getEquivalenceClass() {
		return equivalenceClass;
	}

	public void setEquivalenceClass(Integer equivalenceClass) {
		this.equivalenceClass = equivalenceClass;
	}

	public String getStateSignature() {
		return stateSignature;
	}

	public void setStateSignature(String stateSignature) {
		this.stateSignature = stateSignature;
	}

	public boolean isMinimized() {
		return minimized;
	}

	public void setMinimized(boolean minimized) {
		this.minimized = minimized;
	}

	public Map<String, Object> custom() {
		return custom;
	}

	public void clear() {
		equivalenceClass = null;
		stateSignature = null;
		minimized = false;
		custom.clear();
	}

	NodeMetadata copy() {
		NodeMetadata copy = new NodeMetadata();
		copy.equivalenceClass = equivalenceClass;
		copy.stateSignature = stateSignature;
		copy.minimized = minimized;
		copy.custom.putAll(custom);
		return copy;
	}
}
