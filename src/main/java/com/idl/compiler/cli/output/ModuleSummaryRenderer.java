package com.idl.compiler.cli.output;

import com.idl.compiler.compile.ConstantSpec;
import com.idl.compiler.compile.EnumSpec;
import com.idl.compiler.compile.FieldGroup;
import com.idl.compiler.compile.FieldSpec;
import com.idl.compiler.compile.FunctionSpec;
import com.idl.compiler.compile.Module;
import com.idl.compiler.compile.ServiceSpec;
import com.idl.compiler.compile.Spec;
import com.idl.compiler.compile.StructSpec;
import com.idl.compiler.compile.TypedefSpec;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a linked module as a plain-text summary using {@code templates/module-summary.ftl}.
 */
public class ModuleSummaryRenderer {

    private static final String TEMPLATE_NAME = "module-summary.ftl";

    private final Configuration freemarkerConfig;

    public ModuleSummaryRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(Module module) throws IOException, TemplateException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        template.process(buildModel(module), out);
        return out.toString();
    }

    Map<String, Object> buildModel(Module module) {
        List<Map<String, Object>> types = new ArrayList<>();
        List<Map<String, Object>> services = new ArrayList<>();
        List<Map<String, Object>> constants = new ArrayList<>();

        for (Spec spec : module.getSpecs().values()) {
            if (spec instanceof StructSpec struct) {
                types.add(typeEntry(struct.getKind().getKeyword(), struct.getName(),
                        describeFields(struct.getFields())));
            } else if (spec instanceof EnumSpec enumSpec) {
                types.add(typeEntry("enum", enumSpec.getName(), enumSpec.getItems().stream()
                        .map(item -> item.getName() + " = " + item.getValue())
                        .collect(Collectors.toList())));
            } else if (spec instanceof TypedefSpec typedef) {
                types.add(typeEntry("typedef", typedef.getName(),
                        List.of(typedef.getTarget().getThriftName())));
            } else if (spec instanceof ServiceSpec service) {
                services.add(serviceEntry(service));
            } else if (spec instanceof ConstantSpec constant) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", constant.getName());
                entry.put("type", constant.getType().getThriftName());
                constants.add(entry);
            }
        }

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("name", module.getName());
        model.put("sourceFile", module.getSourceFile() != null ? module.getSourceFile() : "");
        model.put("includes", new ArrayList<>(module.getIncludes().keySet()));
        model.put("types", types);
        model.put("services", services);
        model.put("constants", constants);
        return model;
    }

    /**
     * Functions a service gets from its ancestors, nearest declaration first,
     * keyed by function name and skipping names the service itself declares.
     * The value is the name of the declaring service.
     */
    static Map<FunctionSpec, String> inheritedFunctions(ServiceSpec service) {
        Set<String> seen = new HashSet<>(service.getFunctions().keySet());
        Map<FunctionSpec, String> inherited = new LinkedHashMap<>();
        Set<ServiceSpec> visited = new HashSet<>();
        visited.add(service);

        ServiceSpec current = service.getParentSpec().orElse(null);
        while (current != null && visited.add(current)) {
            for (FunctionSpec function : current.getFunctions().values()) {
                if (seen.add(function.getName())) {
                    inherited.put(function, current.getName());
                }
            }
            current = current.getParentSpec().orElse(null);
        }
        return inherited;
    }

    private Map<String, Object> serviceEntry(ServiceSpec service) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", service.getName());
        entry.put("parent", service.getParentName() != null ? service.getParentName() : "");
        entry.put("functions", service.getFunctions().values().stream()
                .map(this::describeFunction)
                .collect(Collectors.toList()));

        List<String> inherited = new ArrayList<>();
        inheritedFunctions(service).forEach((function, owner) ->
                inherited.add(describeFunction(function) + " (from " + owner + ")"));
        entry.put("inherited", inherited);
        return entry;
    }

    private Map<String, Object> typeEntry(String kind, String name, List<String> members) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("kind", kind);
        entry.put("name", name);
        entry.put("members", members);
        return entry;
    }

    private List<String> describeFields(FieldGroup fields) {
        return fields.getFields().stream()
                .map(this::describeField)
                .collect(Collectors.toList());
    }

    private String describeField(FieldSpec field) {
        return field.getId() + ": " + (field.isRequired() ? "required " : "")
                + field.getType().getThriftName() + " " + field.getName();
    }

    String describeFunction(FunctionSpec function) {
        StringBuilder sb = new StringBuilder();
        if (function.isOneWay()) {
            sb.append("oneway ");
        }
        sb.append(function.getResultSpec() != null ? function.getResultSpec().getThriftName() : "void")
                .append(' ')
                .append(function.getName())
                .append('(')
                .append(String.join(", ", describeFields(function.getArgsSpec())))
                .append(')');
        if (function.getResultSpec() != null && !function.getResultSpec().getExceptions().isEmpty()) {
            sb.append(" throws (")
                    .append(String.join(", ", describeFields(function.getResultSpec().getExceptions())))
                    .append(')');
        }
        return sb.toString();
    }
}
