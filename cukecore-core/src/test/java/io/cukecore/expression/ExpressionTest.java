package io.cukecore.expression;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    private static List<Object> match(String pattern, String text) {
        return Expression.compile(pattern).match(text);
    }

    private static ExpressionException compileError(String pattern) {
        return assertThrows(ExpressionException.class, () -> Expression.compile(pattern));
    }

    @Test
    void testLiteralOnly() {
        Expression expression = Expression.compile("I am a plain step, really!");
        assertEquals(List.of(), expression.match("I am a plain step, really!"));
        assertNull(expression.match("I am a plain step, really"));
        assertNull(expression.match("I am a plain step, really!!"));
        assertNull(expression.match(" I am a plain step, really!"));
        assertNull(expression.match(""));
        assertEquals(1, expression.getNodes().size());
        assertEquals(ExpressionNode.Kind.LITERAL, expression.getNodes().get(0).getKind());
    }

    @Test
    void testInt() {
        assertEquals(List.of(42L), match("I have {int} items", "I have 42 items"));
        assertEquals(List.of(-5L), match("I have {int} items", "I have -5 items"));
        assertEquals(List.of(5L), match("I have {int} items", "I have +5 items"));
        assertNull(match("I have {int} items", "I have many items"));
        assertNull(match("I have {int} items", "I have 4.5 items"));
        assertNull(match("{int}", "42abc"));
    }

    @Test
    void testIntRange() {
        assertEquals(List.of(Long.MAX_VALUE), match("{int}", "9223372036854775807"));
        assertEquals(List.of(Long.MIN_VALUE), match("{int}", "-9223372036854775808"));
        assertEquals(List.of(new BigInteger("99999999999999999999")), match("{int}", "99999999999999999999"));
    }

    @Test
    void testFloat() {
        Expression expression = Expression.compile("price is {float} dollars");
        assertNull(expression.match("price is 20 dollars"));
        assertEquals(List.of(19.99), expression.match("price is 19.99 dollars"));
        assertEquals(List.of(-0.5), expression.match("price is -0.5 dollars"));
        assertNull(expression.match("price is 20. dollars"));
        assertNull(expression.match("price is .5 dollars"));
    }

    @Test
    void testString() {
        assertEquals(List.of("Submit"), match("I click {string} button", "I click \"Submit\" button"));
        assertEquals(List.of(""), match("I click {string} button", "I click \"\" button"));
        assertEquals(List.of("say \"hi\" \\o/"), match("I {string}", "I \"say \\\"hi\\\" \\\\o/\""));
        assertEquals(List.of("a\\b"), match("{string}", "\"a\\b\""));
        assertNull(match("I click {string} button", "I click Submit button"));
        assertNull(match("I click {string} button", "I click \"Submit button"));
    }

    @Test
    void testWord() {
        assertEquals(List.of(5L, "shopping"), match("I add {int} items to my {word} list", "I add 5 items to my shopping list"));
        assertEquals(List.of("ünïcode-ok!"), match("word {word}", "word ünïcode-ok!"));
        assertNull(match("word {word}", "word "));
        assertNull(match("word {word}", "word two words"));
    }

    @Test
    void testAtom() {
        List<Object> args = match("status is {atom}", "status is in_progress");
        assertEquals(List.of(Atom.of("in_progress")), args);
        assertNotEquals("in_progress", args.get(0));
        assertEquals("in_progress", ((Atom) args.get(0)).getName());
        assertEquals(List.of(Atom.of("utf8")), match("use {atom} format", "use utf8 format"));
        assertEquals(List.of(Atom.of("user@host")), match("login as {atom}", "login as user@host"));
        assertNull(match("status is {atom}", "status is in-progress"));
    }

    @Test
    void testOptionalText() {
        Expression expression = Expression.compile("I have cucumber(s)");
        assertEquals(List.of(), expression.match("I have cucumber"));
        assertEquals(List.of(), expression.match("I have cucumbers"));
        assertNull(expression.match("I have cucumberss"));

        expression = Expression.compile("I have {int} cucumber(s) in my belly");
        assertEquals(List.of(1L), expression.match("I have 1 cucumber in my belly"));
        assertEquals(List.of(5L), expression.match("I have 5 cucumbers in my belly"));
    }

    @Test
    void testAlternation() {
        Expression expression = Expression.compile("I click/tap the button");
        assertEquals(List.of(), expression.match("I tap the button"));
        assertEquals(List.of(), expression.match("I click the button"));
        assertNull(expression.match("I push the button"));

        expression = Expression.compile("{int} apple/apples/pear");
        assertEquals(List.of(3L), expression.match("3 pear"));
    }

    @Test
    void testAlternationCommitsToFirstOption() {
        Expression expression = Expression.compile("x/xy z");
        assertEquals(List.of(), expression.match("x z"));
        // no backtracking into the second option
        assertNull(expression.match("xy z"));
    }

    @Test
    void testSlashInsideLiteral() {
        Expression expression = Expression.compile("open http://example.com");
        assertEquals(List.of(), expression.match("open http://example.com"));
        assertEquals(ExpressionNode.Kind.LITERAL, expression.getNodes().get(0).getKind());
        assertEquals(1, expression.getNodes().size());
    }

    @Test
    void testOptionalParameter() {
        Expression expression = Expression.compile("total: {int?}");
        assertEquals(List.of(7L), expression.match("total: 7"));
        assertEquals(Arrays.asList((Object) null), expression.match("total: "));
        assertNull(expression.match("total: x"));

        expression = Expression.compile("{int?}apples");
        assertEquals(Arrays.asList((Object) null), expression.match("apples"));
        assertEquals(List.of(2L), expression.match("2apples"));
    }

    @Test
    void testEscapes() {
        Expression expression = Expression.compile("I see \\{braces\\}");
        assertEquals(List.of(), expression.match("I see {braces}"));
        assertNull(expression.match("I see braces"));
        assertNull(expression.match("I see \\{braces\\}"));
        assertEquals(1, expression.getNodes().size());
        assertEquals("I see {braces}", expression.getNodes().get(0).getText());

        assertEquals(List.of(), match("a \\(b\\) c\\/d \\\\", "a (b) c/d \\"));
    }

    @Test
    void testNodes() {
        Expression expression = Expression.compile("I have {int} cucumber(s) in my basket/bag");
        List<ExpressionNode> nodes = expression.getNodes();
        assertEquals(6, nodes.size());
        assertEquals("I have ", nodes.get(0).getText());
        assertEquals(ExpressionNode.Kind.PARAMETER, nodes.get(1).getKind());
        assertEquals(ParameterType.INT, nodes.get(1).getParameterType());
        assertFalse(nodes.get(1).isOptional());
        assertEquals(" cucumber", nodes.get(2).getText());
        assertEquals(ExpressionNode.Kind.OPTIONAL, nodes.get(3).getKind());
        assertEquals("s", nodes.get(3).getText());
        assertEquals(" in my ", nodes.get(4).getText());
        assertEquals(ExpressionNode.Kind.ALTERNATION, nodes.get(5).getKind());
        assertEquals(List.of("basket", "bag"), nodes.get(5).getOptions());
        assertEquals("I have {int} cucumber(s) in my basket/bag", expression.getPattern());
        assertThrows(UnsupportedOperationException.class, () -> nodes.add(ExpressionNode.literal("x")));
    }

    @Test
    void testUnknownParameterType() {
        ExpressionException e = compileError("I have {bogus} items");
        assertTrue(e.getMessage().contains("bogus"));
        assertEquals("{bogus}", e.getFragment());
        assertEquals(7, e.getIndex());
        assertEquals("I have {bogus} items", e.getPattern());
        // names are case-sensitive
        compileError("{Int}");
    }

    @Test
    void testCompileErrors() {
        assertTrue(compileError("a {} b").getMessage().contains("empty parameter"));
        assertTrue(compileError("a {?} b").getMessage().contains("empty parameter"));
        assertEquals(2, compileError("a {int b").getIndex());
        assertTrue(compileError("a {int b").getMessage().contains("unterminated"));
        assertTrue(compileError("a {in t} b").getMessage().contains("invalid parameter type name"));
        assertTrue(compileError("a () b").getMessage().contains("empty optional"));
        assertTrue(compileError("cucumber(s").getMessage().contains("unterminated"));
        ExpressionException e = compileError("a \\x");
        assertTrue(e.getMessage().contains("invalid escape"));
        assertEquals(2, e.getIndex());
        assertEquals("\\x", e.getFragment());
        assertTrue(compileError("trailing \\").getMessage().contains("invalid escape"));
    }

    @Test
    void testMatchResultIsUnmodifiable() {
        List<Object> args = match("{int}", "1");
        assertThrows(UnsupportedOperationException.class, () -> args.add(2L));
    }

    @Test
    void testCompileOnceMatchMany() {
        Expression expression = Expression.compile("I have {int} items");
        for (int i = 0; i < 100; i++) {
            assertEquals(List.of((long) i), expression.match("I have " + i + " items"));
        }
        assertTrue(expression.matches("I have 3 items"));
        assertFalse(expression.matches("I have three items"));
    }

    @Test
    void testParameterTypeNames() {
        assertEquals(ParameterType.STRING, ParameterType.forName("string"));
        assertEquals(ParameterType.INT, ParameterType.forName("int"));
        assertEquals(ParameterType.FLOAT, ParameterType.forName("float"));
        assertEquals(ParameterType.WORD, ParameterType.forName("word"));
        assertEquals(ParameterType.ATOM, ParameterType.forName("atom"));
        assertNull(ParameterType.forName("bogus"));
        assertEquals("int", ParameterType.INT.getTypeName());
    }

}
