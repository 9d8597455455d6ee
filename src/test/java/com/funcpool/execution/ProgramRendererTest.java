package com.funcpool.execution;

import com.funcpool.canonical.ContentHasher;
import com.funcpool.resolve.BindingEnvironment;
import com.funcpool.resolve.ResolvedProgram;
import com.funcpool.resolve.ResolvedUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ProgramRendererTest {

    private static final String PING = ContentHasher.sha256("ping");
    private static final String PONG = ContentHasher.sha256("pong");

    @Test
    void testEveryUnitIsLinkedInOrder() {
        String script = new ProgramRenderer().render(cycle());

        assertThat(script).startsWith("# funcpool program for object_" + PING + "\n");
        int pong = script.indexOf("    '" + PONG + "',\n    'pong',");
        int ping = script.indexOf("    '" + PING + "',\n    'ping',");
        assertThat(pong).isPositive();
        assertThat(ping).isGreaterThan(pong);
        assertThat(script).contains("_result = _namespace('" + PING + "')._fp_v_0(");
    }

    @Test
    void testSourceIsEmbeddedAsLiteral() {
        String script = new ProgramRenderer().render(cycle());

        assertThat(script).contains("    'def ping(n):\\n    return pong(n)',\n");
        assertThat(script).contains("    'def pong(n):\\n    return ping(n)',\n");
    }

    @Test
    void testBindingsAreSplitByKind() {
        String script = new ProgramRenderer().render(cycle());

        assertThat(script).contains("    ['" + PING + "'],\n    [],\n    [('ping', '" + PING + "')],\n)");
        assertThat(script).contains("    ['" + PONG + "'],\n    [('pong', '" + PONG + "')],\n    [],\n)");
    }

    private static ResolvedProgram cycle() {
        BindingEnvironment environment = new BindingEnvironment();
        environment.bind(PONG, "ping", PING, true);
        environment.bind(PING, "pong", PONG, false);
        return new ResolvedProgram(List.of(unit(PONG, "pong", "ping", PING), unit(PING, "ping", "pong", PONG)),
                environment, PING);
    }

    private static ResolvedUnit unit(String hash, String name, String callee, String reference) {
        return ResolvedUnit.builder()
                .hash(hash)
                .language("eng")
                .functionName(name)
                .displaySource("def " + name + "(n):\n    return " + callee + "(n)")
                .source("def " + name + "(n):\n    return " + callee + "(n)")
                .references(List.of(reference))
                .build();
    }
}
