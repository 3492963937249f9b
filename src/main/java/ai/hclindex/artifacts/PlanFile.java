package ai.hclindex.artifacts;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized JSON plan ({@code terraform show -json}).
 */
public record PlanFile(
        String formatVersion,
        String terraformVersion,
        PlannedValues plannedValues,  // null when the plan has none
        List<ResourceChange> resourceChanges,
        String source
) {
    public PlanFile {
        resourceChanges = List.copyOf(resourceChanges);
    }

    public record PlannedValues(Module rootModule) {
    }

    public record Module(String address, List<Resource> resources, List<Module> childModules) {
        public Module {
            resources = List.copyOf(resources);
            childModules = List.copyOf(childModules);
        }
    }

    public record Resource(
            String address,
            String mode,
            String type,
            String name,
            String providerName,
            JsonNode values
    ) {
    }

    public record ResourceChange(
            String address,
            String moduleAddress,
            String mode,
            String type,
            String name,
            String providerName,
            Change change
    ) {
    }

    public record Change(
            List<String> actions,
            JsonNode before,
            JsonNode after,
            JsonNode afterUnknown,
            JsonNode beforeSensitive,
            JsonNode afterSensitive
    ) {
        public Change {
            actions = List.copyOf(actions);
        }
    }
}
