package dev.tessera.testrunner.index;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SymbolKind {
	@JsonProperty("class")
	CLASS,

	@JsonProperty("trait")
	TRAIT,

	@JsonProperty("module")
	MODULE,
	;
}
