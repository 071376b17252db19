package com.idl.compiler.cli.output;

import com.idl.compiler.compile.FunctionSpec;
import com.idl.compiler.compile.Module;
import com.idl.compiler.compile.ModuleCompiler;
import com.idl.compiler.compile.ServiceSpec;
import com.idl.compiler.parser.IdlParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ModuleSummaryRendererTest {

    private static final String SOURCE = """
            exception KeyDoesNotExist {}
            service KeyValue {
                void setValue(1: string key, 2: binary value)
                binary getValue(1: string key) throws (1: KeyDoesNotExist doesNotExist)
            }
            service BulkKeyValue extends KeyValue {
                void setValues(1: map<string, binary> items)
                binary getValue(1: string key)
            }
            service AuditedKeyValue extends BulkKeyValue {
                oneway void audit(1: required string entry)
            }
            enum Mode { FAST, SAFE = 4 }
            const i32 LIMIT = 10
            """;

    private final ModuleSummaryRenderer renderer = new ModuleSummaryRenderer();

    @Test
    void testInheritedFunctionsWalkParentChain() {
        Module module = compile();
        ServiceSpec audited = module.findService("AuditedKeyValue").orElseThrow();

        Map<FunctionSpec, String> inherited = ModuleSummaryRenderer.inheritedFunctions(audited);

        assertThat(inherited.keySet()).extracting(FunctionSpec::getName)
                .containsExactly("setValues", "getValue", "setValue");
        assertThat(inherited.values()).containsExactly("BulkKeyValue", "BulkKeyValue", "KeyValue");
        assertThat(audited.getFunctions()).containsOnlyKeys("audit");
    }

    @Test
    void testRenderSummary() throws Exception {
        String summary = renderer.render(compile());

        assertThat(summary).contains(
                "Module kv (kv.thrift)",
                "exception KeyDoesNotExist",
                "service KeyValue",
                "    binary getValue(1: string key) throws (1: KeyDoesNotExist doesNotExist)",
                "service BulkKeyValue extends KeyValue",
                "    void setValues(1: map<string, binary> items)",
                "    void setValue(1: string key, 2: binary value) (from KeyValue)",
                "service AuditedKeyValue extends BulkKeyValue",
                "    oneway void audit(1: required string entry)",
                "enum Mode",
                "    SAFE = 4",
                "const i32 LIMIT");
        assertThat(summary).doesNotContain("Includes:");
    }

    private static Module compile() {
        return new ModuleCompiler().compile(IdlParser.parse(SOURCE, "kv.thrift"));
    }
}
