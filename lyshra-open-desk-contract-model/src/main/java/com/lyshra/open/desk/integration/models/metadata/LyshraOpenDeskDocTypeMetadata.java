package com.lyshra.open.desk.integration.models.metadata;

import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskPermissionRule;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
public class LyshraOpenDeskDocTypeMetadata implements ILyshraOpenDeskDocTypeMetadata {
    private final String name;
    @Builder.Default
    private final List<ILyshraOpenDeskFieldDefinition> fields = List.of();
    @Builder.Default
    private final List<ILyshraOpenDeskPermissionRule> permissionRules = List.of();
    private final boolean submittable;
    private final boolean renameAllowed;
    private final boolean table;
    private final boolean single;
    private final String autoname;
    @Builder.Default
    private final Map<String, List<String>> linkedWith = Map.of();

    @Override
    public Optional<String> getAutoname() {
        return Optional.ofNullable(autoname);
    }
}
