package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrDocument;
import info.isaksson.erland.componentir.ir.IrTagHelper;
import info.isaksson.erland.componentir.ir.IrTagHelperDescriptor;
import info.isaksson.erland.componentir.ir.IrTagHelperProperty;
import info.isaksson.erland.componentir.ir.IrToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrPassPipelineTest {

    @Test
    void runsPassesByAscendingOrderKeepingRegistrationOrderForTies() {
        List<String> log = new ArrayList<>();
        IrPassPipeline pipeline = new IrPassPipeline(List.of(
                new Recording("late", 10, log),
                new Recording("tieA", 0, log),
                new Recording("early", -5, log),
                new Recording("tieB", 0, log)));

        pipeline.run(new IrDocument(List.of()));

        assertEquals(List.of("early", "tieA", "tieB", "late"), log);
        assertEquals(4, pipeline.passes().size());
    }

    @Test
    void complexContentPassRunsBeforeDefaultOrderedPasses() {
        List<String> seen = new ArrayList<>();
        IrDocumentPass observer = new IrDocumentPass() {
            @Override public int order() { return 0; }
            @Override public void execute(IrDocument document) {
                IrTagHelper usage = (IrTagHelper) document.children.get(0);
                seen.add(usage.children.size() + ":" + usage.diagnostics.size());
            }
        };
        IrTagHelper usage = new IrTagHelper("Counter",
                List.of(IrTagHelperDescriptor.of("Counter", ComponentDescriptors.COMPONENT_KIND)),
                List.of(new IrTagHelperProperty("x", List.of(IrToken.markup("a"), IrToken.code("b")))));

        new IrPassPipeline(List.of(observer, new ComplexAttributeContentPass())).run(new IrDocument(List.of(usage)));

        assertEquals(List.of("0:1"), seen);
    }

    @Test
    void rejectsNullDocumentAndNullPass() {
        assertThrows(IllegalArgumentException.class, () -> new IrPassPipeline(List.of()).run(null));
        List<IrDocumentPass> withNull = new ArrayList<>();
        withNull.add(null);
        assertThrows(NullPointerException.class, () -> new IrPassPipeline(withNull));
    }

    @Test
    void passNameDefaultsToSimpleClassName() {
        assertEquals("ComplexAttributeContentPass", new ComplexAttributeContentPass().name());
    }

    private static final class Recording implements IrDocumentPass {
        private final String label;
        private final int order;
        private final List<String> log;

        Recording(String label, int order, List<String> log) {
            this.label = label;
            this.order = order;
            this.log = log;
        }

        @Override public int order() { return order; }

        @Override public void execute(IrDocument document) {
            log.add(label);
        }
    }
}
