package dev.tessera.testrunner.index;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

@JacksonXmlRootElement(localName = "Apis")
public class ApiIndex {

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "Api")
	private List<ApiEntry> apis = List.of();

	public List<ApiEntry> getApis() {
		return apis;
	}

	public void setApis(List<ApiEntry> apis) {
		this.apis = apis;
	}
}
