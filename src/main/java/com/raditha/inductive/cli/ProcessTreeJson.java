package com.raditha.inductive.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.inductive.model.ProcessTree;

import java.util.List;

/**
 * JSON rendering of a process tree.
 */
public class ProcessTreeJson {

    private static final ObjectMapper mapper = new ObjectMapper();

    private ProcessTreeJson() {
    }

    /**
     * One tree node. {@code type} is {@code activity}, {@code silent} or the operator name.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record NodeDTO(String type, String label, List<NodeDTO> children) {
    }

    public static NodeDTO toDto(ProcessTree tree) {
        if (tree.isSilent()) {
            return new NodeDTO("silent", null, List.of());
        }
        if (tree.isLeaf()) {
            return new NodeDTO("activity", tree.label(), List.of());
        }
        return new NodeDTO(tree.operator().name().toLowerCase(), null,
                tree.children().stream().map(ProcessTreeJson::toDto).toList());
    }

    public static String write(ProcessTree tree) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDto(tree));
    }

    public static NodeDTO read(String json) throws JsonProcessingException {
        return mapper.readValue(json, NodeDTO.class);
    }
}
