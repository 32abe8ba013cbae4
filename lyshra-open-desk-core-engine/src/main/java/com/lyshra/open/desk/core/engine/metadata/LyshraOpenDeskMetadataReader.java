package com.lyshra.open.desk.core.engine.metadata;

import com.lyshra.open.desk.core.engine.misc.LyshraOpenDeskObjectMapper;
import com.lyshra.open.desk.core.exception.metadata.LyshraOpenDeskMetadataReadException;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskObjectMapper;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskWorkflowTransition;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentShare;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskPermissionRule;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskWorkflowTransition;
import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocumentShare;
import com.lyshra.open.desk.integration.models.metadata.LyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.models.metadata.LyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.models.metadata.LyshraOpenDeskPermissionRule;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the server's JSON payloads (document type meta, documents, docinfo and workflow
 * transitions) onto the contract models. Keys follow the server's snake case names.
 */
@Slf4j
public class LyshraOpenDeskMetadataReader {

    private final ILyshraOpenDeskObjectMapper objectMapper;

    public LyshraOpenDeskMetadataReader() {
        this(LyshraOpenDeskObjectMapper.getInstance());
    }

    public LyshraOpenDeskMetadataReader(ILyshraOpenDeskObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LyshraOpenDeskDocTypeMetadata readDocTypeMetadata(InputStream json) {
        return readDocTypeMetadata(readObject(json, "document type"));
    }

    public LyshraOpenDeskDocTypeMetadata readDocTypeMetadata(Map<String, ?> meta) {
        if (meta == null) {
            throw new LyshraOpenDeskMetadataReadException("Document type metadata is missing");
        }
        String name = LyshraOpenDeskValues.cstr(meta.get("name"));
        if (name.isBlank()) {
            throw new LyshraOpenDeskMetadataReadException("Document type metadata has no name");
        }

        List<ILyshraOpenDeskFieldDefinition> fields = new ArrayList<>();
        for (Map<String, Object> field : objectList(meta.get("fields"), name + ".fields")) {
            fields.add(readField(field, name));
        }
        List<ILyshraOpenDeskPermissionRule> rules = new ArrayList<>();
        for (Map<String, Object> permission : objectList(meta.get("permissions"), name + ".permissions")) {
            rules.add(readPermissionRule(permission));
        }

        LyshraOpenDeskDocTypeMetadata metadata = LyshraOpenDeskDocTypeMetadata.builder()
                .name(name)
                .fields(List.copyOf(fields))
                .permissionRules(List.copyOf(rules))
                .submittable(flag(meta, "is_submittable"))
                .renameAllowed(flag(meta, "allow_rename"))
                .table(flag(meta, "istable"))
                .single(flag(meta, "issingle"))
                .autoname(optionalString(meta.get("autoname")))
                .linkedWith(readLinkedWith(meta.get("__linked_with")))
                .build();
        log.debug("Read metadata for [{}]: [{}] fields, [{}] permission rules", name, fields.size(), rules.size());
        return metadata;
    }

    public LyshraOpenDeskDocument readDocument(InputStream json) {
        return readDocument(readObject(json, "document"));
    }

    public LyshraOpenDeskDocument readDocument(Map<String, ?> document) {
        if (document == null) {
            throw new LyshraOpenDeskMetadataReadException("Document is missing");
        }
        return LyshraOpenDeskDocument.of(document);
    }

    public LyshraOpenDeskDocumentOverlay readDocumentOverlay(InputStream json) {
        return readDocumentOverlay(readObject(json, "docinfo"));
    }

    /**
     * An absent {@code permissions} object stays absent; permission checks treat that as denied.
     */
    public LyshraOpenDeskDocumentOverlay readDocumentOverlay(Map<String, ?> docinfo) {
        if (docinfo == null) {
            return LyshraOpenDeskDocumentOverlay.empty();
        }
        Map<LyshraOpenDeskPermissionType, Boolean> permissions = null;
        Object rawPermissions = docinfo.get("permissions");
        if (rawPermissions instanceof Map<?, ?> permissionMap) {
            permissions = new EnumMap<>(LyshraOpenDeskPermissionType.class);
            for (Map.Entry<?, ?> entry : permissionMap.entrySet()) {
                Map<LyshraOpenDeskPermissionType, Boolean> target = permissions;
                LyshraOpenDeskPermissionType.fromKey(String.valueOf(entry.getKey()))
                        .ifPresent(type -> target.put(type, LyshraOpenDeskValues.isTruthy(entry.getValue())));
            }
        } else if (rawPermissions != null) {
            throw new LyshraOpenDeskMetadataReadException("docinfo.permissions must be an object");
        }

        List<ILyshraOpenDeskDocumentShare> shared = new ArrayList<>();
        for (Map<String, Object> share : objectList(docinfo.get("shared"), "docinfo.shared")) {
            shared.add(LyshraOpenDeskDocumentShare.builder()
                    .user(optionalString(share.get("user")))
                    .read(flag(share, "read"))
                    .write(flag(share, "write"))
                    .submit(flag(share, "submit"))
                    .share(flag(share, "share"))
                    .build());
        }
        return LyshraOpenDeskDocumentOverlay.builder()
                .permissions(permissions)
                .shared(List.copyOf(shared))
                .build();
    }

    public List<ILyshraOpenDeskWorkflowTransition> readWorkflowTransitions(Object transitions) {
        List<ILyshraOpenDeskWorkflowTransition> result = new ArrayList<>();
        for (Map<String, Object> transition : objectList(transitions, "transitions")) {
            String action = optionalString(transition.get("action"));
            if (action == null) {
                throw new LyshraOpenDeskMetadataReadException("Workflow transition without action: " + transition);
            }
            String nextState = optionalString(transition.get("next_state"));
            result.add(LyshraOpenDeskWorkflowTransition.builder()
                    .action(action)
                    .targetState(nextState != null ? nextState : optionalString(transition.get("state")))
                    .allowedRoles(readRoles(transition.get("allowed")))
                    .condition(optionalString(transition.get("condition")))
                    .build());
        }
        return List.copyOf(result);
    }

    private LyshraOpenDeskFieldDefinition readField(Map<String, Object> field, String docType) {
        String fieldName = optionalString(field.get("fieldname"));
        String fieldType = optionalString(field.get("fieldtype"));
        if (fieldType == null) {
            throw new LyshraOpenDeskMetadataReadException(
                    String.format("Field [%s] of [%s] has no fieldtype", fieldName, docType));
        }
        Integer length = LyshraOpenDeskValues.cint(field.get("length"));
        return LyshraOpenDeskFieldDefinition.builder()
                .fieldName(fieldName)
                .fieldType(fieldType)
                .label(optionalString(field.get("label")))
                .permissionLevel(Math.max(0, LyshraOpenDeskValues.cint(field.get("permlevel"))))
                .required(flag(field, "reqd"))
                .readOnly(flag(field, "read_only"))
                .hidden(flag(field, "hidden"))
                .allowOnSubmit(flag(field, "allow_on_submit"))
                .noCopy(flag(field, "no_copy"))
                .visibilityExpression(expression(field.get("depends_on")))
                .requiredExpression(expression(field.get("mandatory_depends_on")))
                .readOnlyExpression(expression(field.get("read_only_depends_on")))
                .maxLength(length > 0 ? length : null)
                .options(optionalString(field.get("options")))
                .build();
    }

    private LyshraOpenDeskPermissionRule readPermissionRule(Map<String, Object> permission) {
        return LyshraOpenDeskPermissionRule.builder()
                .role(optionalString(permission.get("role")))
                .permissionLevel(Math.max(0, LyshraOpenDeskValues.cint(permission.get("permlevel"))))
                .read(flag(permission, "read"))
                .write(flag(permission, "write"))
                .create(flag(permission, "create"))
                .delete(flag(permission, "delete"))
                .submit(flag(permission, "submit"))
                .cancel(flag(permission, "cancel"))
                .amend(flag(permission, "amend"))
                .print(flag(permission, "print"))
                .email(flag(permission, "email"))
                .export(flag(permission, "export"))
                .dataImport(flag(permission, "import"))
                .share(flag(permission, "share"))
                .ownerOnly(flag(permission, "if_owner"))
                .build();
    }

    private Map<String, List<String>> readLinkedWith(Object linkedWith) {
        if (!(linkedWith instanceof Map<?, ?> linkedMap)) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        linkedMap.forEach((docType, value) -> {
            List<String> fieldNames = new ArrayList<>();
            if (value instanceof Map<?, ?> details && details.get("fieldname") instanceof List<?> names) {
                names.forEach(name -> fieldNames.add(String.valueOf(name)));
            } else if (value instanceof List<?> names) {
                names.forEach(name -> fieldNames.add(String.valueOf(name)));
            }
            result.put(String.valueOf(docType), List.copyOf(fieldNames));
        });
        return result;
    }

    private static List<String> readRoles(Object allowed) {
        if (allowed instanceof List<?> roles) {
            return roles.stream().map(String::valueOf).map(String::trim).filter(role -> !role.isEmpty()).toList();
        }
        String roles = optionalString(allowed);
        if (roles == null) {
            return List.of();
        }
        return Arrays.stream(roles.split(",")).map(String::trim).filter(role -> !role.isEmpty()).toList();
    }

    /**
     * Expressions arrive as strings; a bare boolean or 0/1 is kept as a literal.
     */
    private static Object expression(Object raw) {
        if (raw instanceof Boolean) {
            return raw;
        }
        if (raw instanceof Number) {
            return LyshraOpenDeskValues.isTruthy(raw);
        }
        return optionalString(raw);
    }

    private static boolean flag(Map<String, ?> source, String key) {
        return LyshraOpenDeskValues.isTruthy(source.get(key));
    }

    private static String optionalString(Object value) {
        String text = LyshraOpenDeskValues.cstr(value);
        return text.isBlank() ? null : text;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> objectList(Object value, String path) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new LyshraOpenDeskMetadataReadException(path + " must be an array");
        }
        List<Map<String, Object>> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw new LyshraOpenDeskMetadataReadException(path + " must contain objects, found: " + item);
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readObject(InputStream json, String what) {
        try {
            Object value = objectMapper.readValue(json, Object.class);
            if (!(value instanceof Map<?, ?>)) {
                throw new LyshraOpenDeskMetadataReadException(what + " JSON must be an object");
            }
            return (Map<String, Object>) value;
        } catch (LyshraOpenDeskMetadataReadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LyshraOpenDeskMetadataReadException("Failed to read " + what + " JSON", e);
        }
    }
}
