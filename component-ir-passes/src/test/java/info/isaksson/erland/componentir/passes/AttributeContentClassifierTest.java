package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrAttributeValue;
import info.isaksson.erland.componentir.ir.IrCodeBlock;
import info.isaksson.erland.componentir.ir.IrExpression;
import info.isaksson.erland.componentir.ir.IrHtmlAttribute;
import info.isaksson.erland.componentir.ir.IrMarkupElement;
import info.isaksson.erland.componentir.ir.IrNode;
import info.isaksson.erland.componentir.ir.IrTemplate;
import info.isaksson.erland.componentir.ir.IrToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AttributeContentClassifierTest {

    @Test
    void htmlAttributeWithSeveralFragmentsIsComplex() {
        IrHtmlAttribute value = new IrHtmlAttribute("title", List.of(
                new IrAttributeValue("", List.of(IrToken.markup("Hello "))),
                new IrAttributeValue("", List.of(IrToken.code("name")))));
        List<IrNode> content = content(value);

        assertEquals(ContentVerdict.COMPLEX, AttributeContentClassifier.classifyAndSimplify(content));
        assertEquals(1, content.size());
        assertEquals(2, value.children.size());
    }

    @Test
    void htmlAttributeWithOneFragmentIsSimple() {
        IrHtmlAttribute value = new IrHtmlAttribute("title", List.of(
                new IrAttributeValue("", List.of(IrToken.markup("Hello")))));
        assertEquals(ContentVerdict.SIMPLE, AttributeContentClassifier.classifyAndSimplify(content(value)));
    }

    @Test
    void parenthesizedExpressionIsUnwrapped() {
        IrToken body = IrToken.code("x => Count++");
        IrExpression expr = new IrExpression(List.of(IrToken.code("("), body, IrToken.code(")")));

        assertEquals(ContentVerdict.SIMPLE, AttributeContentClassifier.classifyAndSimplify(content(expr)));
        assertEquals(List.of(body), expr.children);
    }

    @Test
    void parenthesizedExpressionKeepsArbitraryMiddleNode() {
        IrTemplate middle = new IrTemplate(List.of(IrToken.markup("<i/>")));
        IrExpression expr = new IrExpression(List.of(IrToken.code("("), middle, IrToken.code(")")));

        assertEquals(ContentVerdict.SIMPLE, AttributeContentClassifier.classifyAndSimplify(content(expr)));
        assertEquals(1, expr.children.size());
        assertSame(middle, expr.children.get(0));
    }

    @Test
    void threeTokensWithoutMatchingParensAreComplex() {
        IrExpression expr = new IrExpression(List.of(IrToken.code("("), IrToken.code("x"), IrToken.code(") ")));

        assertEquals(ContentVerdict.COMPLEX, AttributeContentClassifier.classifyAndSimplify(content(expr)));
        assertEquals(3, expr.children.size());
    }

    @Test
    void parenthesizedTemplateIsUnwrappedAndTransitionsStripped() {
        IrExpression leading = new IrExpression(List.of(IrToken.code("@"), IrToken.code("context")));
        IrExpression notLeading = new IrExpression(List.of(IrToken.code("a"), IrToken.code("@")));
        IrExpression nested = new IrExpression(List.of(IrToken.code("@"), IrToken.code("b")));
        IrTemplate template = new IrTemplate(List.of(
                IrToken.markup("<div>"),
                leading,
                new IrMarkupElement("span", List.of(nested)),
                notLeading,
                IrToken.markup("</div>")));
        IrExpression expr = new IrExpression(List.of(
                IrToken.code("("), template, IrToken.code(""), IrToken.code(")")));

        assertEquals(ContentVerdict.SIMPLE, AttributeContentClassifier.classifyAndSimplify(content(expr)));
        assertEquals(List.of(template), expr.children);
        assertEquals(1, leading.children.size());
        assertTrue(IrToken.is(leading.children.get(0), "context"));
        assertEquals(1, nested.children.size());
        assertTrue(IrToken.is(nested.children.get(0), "b"));
        assertEquals(2, notLeading.children.size());
        assertEquals(5, template.children.size());
    }

    @Test
    void parenthesizedTemplateRequiresEmptyThirdToken() {
        IrExpression inner = new IrExpression(List.of(IrToken.code("@"), IrToken.code("x")));
        IrTemplate template = new IrTemplate(List.of(inner));
        IrExpression expr = new IrExpression(List.of(
                IrToken.code("("), template, IrToken.code(" "), IrToken.code(")")));

        assertEquals(ContentVerdict.COMPLEX, AttributeContentClassifier.classifyAndSimplify(content(expr)));
        assertEquals(4, expr.children.size());
        assertEquals(2, inner.children.size());
    }

    @Test
    void parenthesizedNonTemplateWithFourChildrenIsComplex() {
        IrExpression expr = new IrExpression(List.of(
                IrToken.code("("), IrToken.code("x"), IrToken.code(""), IrToken.code(")")));

        assertEquals(ContentVerdict.COMPLEX, AttributeContentClassifier.classifyAndSimplify(content(expr)));
        assertEquals(4, expr.children.size());
    }

    @Test
    void expressionWithTwoChildrenIsComplex() {
        IrExpression expr = new IrExpression(List.of(IrToken.code("a"), IrToken.code("b")));

        assertEquals(ContentVerdict.COMPLEX, AttributeContentClassifier.classifyAndSimplify(content(expr)));
        assertEquals(2, expr.children.size());
    }

    @Test
    void expressionWithOneChildIsSimple() {
        IrExpression expr = new IrExpression(List.of(IrToken.code("Count")));
        assertEquals(ContentVerdict.SIMPLE, AttributeContentClassifier.classifyAndSimplify(content(expr)));
    }

    @Test
    void codeBlockIsAlwaysComplex() {
        assertEquals(ContentVerdict.COMPLEX,
                AttributeContentClassifier.classifyAndSimplify(content(new IrCodeBlock(List.of()))));
        assertEquals(ContentVerdict.COMPLEX,
                AttributeContentClassifier.classifyAndSimplify(content(new IrCodeBlock(List.of(IrToken.code("x"))))));
    }

    @Test
    void severalTopLevelChildrenAreComplex() {
        List<IrNode> content = new ArrayList<>(List.of(IrToken.markup("a"), new IrExpression(List.of(IrToken.code("b")))));

        assertEquals(ContentVerdict.COMPLEX, AttributeContentClassifier.classifyAndSimplify(content));
        assertEquals(2, content.size());
    }

    @Test
    void severalTopLevelParenthesizedChildrenAreNotRewritten() {
        IrExpression expr = new IrExpression(List.of(IrToken.code("("), IrToken.code("x"), IrToken.code(")")));
        List<IrNode> content = new ArrayList<>(List.of(expr, IrToken.markup("!")));

        assertEquals(ContentVerdict.COMPLEX, AttributeContentClassifier.classifyAndSimplify(content));
        assertEquals(3, expr.children.size());
    }

    @Test
    void singleTokenAndEmptyContentAreSimple() {
        assertEquals(ContentVerdict.SIMPLE, AttributeContentClassifier.classifyAndSimplify(content(IrToken.markup("btn"))));
        assertEquals(ContentVerdict.SIMPLE, AttributeContentClassifier.classifyAndSimplify(new ArrayList<>()));
    }

    private static List<IrNode> content(IrNode only) {
        return new ArrayList<>(List.of(only));
    }
}
