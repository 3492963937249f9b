package ai.hclindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * count.index; carries no payload, so all instances are equal.
 */
public record CountReference() implements Reference {

    @JsonProperty("property")
    public String property() {
        return "index";
    }
}
