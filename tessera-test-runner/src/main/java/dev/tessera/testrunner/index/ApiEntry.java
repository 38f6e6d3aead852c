package dev.tessera.testrunner.index;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

import java.util.List;

public class ApiEntry {

	@JacksonXmlProperty(isAttribute = true, localName = "name")
	private String name;

	@JacksonXmlProperty(isAttribute = true, localName = "kind")
	private SymbolKind kind = SymbolKind.CLASS;

	@JacksonXmlProperty(isAttribute = true, localName = "abstract")
	private boolean abstractSymbol = false;

	@JacksonXmlProperty(isAttribute = true, localName = "noArgConstructor")
	private boolean noArgConstructor = true;

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "BaseClass")
	private List<String> baseClasses = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Annotation")
	private List<String> annotations = List.of();

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "MethodAnnotation")
	private List<String> methodAnnotations = List.of();

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public SymbolKind getKind() {
		return kind;
	}

	public void setKind(SymbolKind kind) {
		this.kind = kind;
	}

	public boolean isAbstractSymbol() {
		return abstractSymbol;
	}

	public void setAbstractSymbol(boolean abstractSymbol) {
		this.abstractSymbol = abstractSymbol;
	}

	public boolean isNoArgConstructor() {
		return noArgConstructor;
	}

	public void setNoArgConstructor(boolean noArgConstructor) {
		this.noArgConstructor = noArgConstructor;
	}

	public List<String> getBaseClasses() {
		return baseClasses;
	}

	public void setBaseClasses(List<String> baseClasses) {
		this.baseClasses = baseClasses;
	}

	public List<String> getAnnotations() {
		return annotations;
	}

	public void setAnnotations(List<String> annotations) {
		this.annotations = annotations;
	}

	public List<String> getMethodAnnotations() {
		return methodAnnotations;
	}

	public void setMethodAnnotations(List<String> methodAnnotations) {
		this.methodAnnotations = methodAnnotations;
	}

	@Override
	public String toString() {
		return "ApiEntry{" +
				"name='" + name + '\'' +
				", kind=" + kind +
				", abstract=" + abstractSymbol +
				", baseClasses=" + baseClasses +
				", annotations=" + annotations +
				'}';
	}
}
