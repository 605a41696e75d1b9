// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.mork.GroupMismatchException;
import com.amazon.mork.InvalidIdentifierException;
import com.amazon.mork.MorkLexicalException;
import com.amazon.mork.MorkParseException;
import com.amazon.mork.MorkParseResult;
import com.amazon.mork.MorkRow;
import com.amazon.mork.MorkSyntaxException;
import com.amazon.mork.MorkTable;
import com.amazon.mork.SourcePosition;
import com.amazon.mork.UnresolvedReferenceException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class MorkParserTest
{
    private static final String SOURCE = "test.mork";

    private static MorkParser parser(String text, boolean validateGroupIds)
    {
        MorkLexer lexer = new MorkLexer(text.getBytes(StandardCharsets.UTF_8));
        LiteralDecoder decoder = new LiteralDecoder(StandardCharsets.UTF_8, true);
        return new MorkParser(SOURCE, lexer, decoder, validateGroupIds);
    }

    private static MorkParseResult parse(String text)
    {
        return parser(text, true).parse();
    }

    /** parses input that must be valid */
    private static Map<String, MorkTable> tables(String text)
    {
        MorkParseResult result = parse(text);
        assertNull(result.getError(), () -> "unexpected error: " + result.getError());
        return result.getTables();
    }

    private static <T extends MorkParseException> T error(String text, Class<T> type)
    {
        MorkParseException e = parse(text).getError();
        assertNotNull(e, "expected an error");
        assertThat(e, instanceOf(type));
        return type.cast(e);
    }

    private static String cell(Map<String, MorkTable> tables, String table, String row, String column)
    {
        MorkTable t = tables.get(table);
        assertNotNull(t, "no table " + table + " in " + tables.keySet());
        MorkRow r = t.getRow(row);
        assertNotNull(r, "no row " + row + " in " + t);
        return r.get(column);
    }

    @Test
    public void testLiteralOnlyDocument()
    {
        Map<String, MorkTable> tables = tables("<(name =Alice)>{10{(owner=Alice)}[20(name=Bob)]}");

        assertThat(tables.keySet(), contains("10:c"));
        MorkTable table = tables.get("10:c");
        assertEquals(Collections.singletonMap("owner", "Alice"), table.getMeta());
        assertThat(table.getRows().keySet(), contains("20"));
        assertEquals(Collections.singletonMap("name", "Bob"), table.getRow("20").getCells());
    }

    @Test
    public void testEmptyInput()
    {
        assertTrue(tables("").isEmpty());
        assertTrue(tables("  // only a comment\n").isEmpty());
    }

    @Test
    public void testReferencesResolveThroughDictionaries()
    {
        Map<String, MorkTable> tables = tables(
            "< <(a=c)> (80=ns:addrbk:db:row:scope:card:all)(81=FirstName)(82=LastName)(83=kind)>\n"
          + "<(90=John)(91=Doe)(92=cards)>\n"
          + "{1:^80 {(k^83:c)(s^92)} [1(^81^90)(^82^91)]}\n");

        String id = "1:ns:addrbk:db:row:scope:card:all";
        assertThat(tables.keySet(), contains(id));
        MorkTable table = tables.get(id);
        assertEquals("ns:addrbk:db:row:scope:card:all", table.getRowScope());
        assertEquals("kind", table.getMeta().get("k"));
        assertEquals("cards", table.getMeta().get("s"));
        assertEquals("John", cell(tables, id, "1", "FirstName"));
        assertEquals("Doe", cell(tables, id, "1", "LastName"));
    }

    @Test
    public void testScopeGivenAsReference()
    {
        Map<String, MorkTable> tables = tables("<(80=ns:x)>{1:^80:a [1(c=v)]}");
        assertThat(tables.keySet(), contains("1:ns:x"));
    }

    @Test
    public void testUnresolvedReferenceInExplicitNamespace()
    {
        UnresolvedReferenceException e =
            error("{1[2(col^ff:missing)]}", UnresolvedReferenceException.class);
        assertEquals("ff", e.getId());
        assertEquals("missing", e.getNamespace());
        assertEquals(new SourcePosition(8, 1, 8), e.getPosition());
        assertEquals("test.mork: bad alias ff:missing at line 1 column 8", e.getMessage());
    }

    @Test
    public void testUnresolvedColumnUsesColumnNamespace()
    {
        UnresolvedReferenceException e = error("{1[2(^80=x)]}", UnresolvedReferenceException.class);
        assertEquals("80", e.getId());
        assertEquals("c", e.getNamespace());
    }

    @Test
    public void testUnresolvedValueUsesAtomNamespace()
    {
        UnresolvedReferenceException e = error("{1[2(x^80)]}", UnresolvedReferenceException.class);
        assertEquals("a", e.getNamespace());
    }

    @Test
    public void testLaterDefinitionWins()
    {
        assertEquals("two", cell(tables("<(80=one)><(80=two)>{1[1(a^80)]}"), "1:c", "1", "a"));
        assertEquals("two", cell(tables("<(80=one)(80=two)>{1[1(a^80)]}"), "1:c", "1", "a"));
    }

    @Test
    public void testForwardReferenceFails()
    {
        MorkParseResult result = parse("{1[1(a^80)]}<(80=late)>");
        assertThat(result.getError(), instanceOf(UnresolvedReferenceException.class));
        assertTrue(result.getTables().isEmpty());
    }

    @Test
    public void testReferenceWithinSameDictFails()
    {
        error("<(80=x)(81^80)>", UnresolvedReferenceException.class);
    }

    @Test
    public void testTablesCoalesceByIdAndScope()
    {
        Map<String, MorkTable> tables = tables("{1:x[1(a=p)]}{1:y[1(a=q)]}{1:x[2(a=r)]}");
        assertThat(tables.keySet(), contains("1:x", "1:y"));
        assertThat(tables.get("1:x").getRows().keySet(), contains("2"));
        assertEquals("q", cell(tables, "1:y", "1", "a"));
    }

    @Test
    public void testRowScopeOverride()
    {
        Map<String, MorkTable> tables = tables("{1:t {(r=s)} [1(a=x)] [2:u(a=y)] [3:s(a=z)]}");
        MorkTable table = tables.get("1:t");
        assertEquals("s", table.getRowScope());
        assertEquals("s", table.getMeta().get(MorkTable.ROW_SCOPE_CELL));
        assertThat(table.getRows().keySet(), contains("1", "2:u", "3"));
    }

    @Test
    public void testRowInOtherScopeIsKeyedWithScope()
    {
        Map<String, MorkTable> tables = tables("{1 [1:x(a=v)] [1(a=w)]}");
        assertThat(tables.get("1:c").getRows().keySet(), contains("1:x", "1"));
    }

    @Test
    public void testMetatableCapturesCellsAndMetarows()
    {
        MorkTable table = tables("{1 {(k=v)[(m=n)(o=p)]} }").get("1:c");
        assertEquals("v", table.getMeta().get("k"));
        assertEquals("n", table.getMeta().get("m"));
        assertEquals("p", table.getMeta().get("o"));
        assertTrue(table.getRows().isEmpty());
    }

    @Test
    public void testRowMetarow()
    {
        MorkRow row = tables("{1 [1 [(sel=yes)] (a=x)]}").get("1:c").getRow("1");
        assertEquals(Collections.singletonMap("sel", "yes"), row.getMeta());
        assertEquals(Collections.singletonMap("a", "x"), row.getCells());
    }

    @Test
    public void testRowRedefinitionReplacesRow()
    {
        MorkRow row = tables("{1 [1(a=x)(b=y)] [1(a=z)]}").get("1:c").getRow("1");
        assertEquals(Collections.singletonMap("a", "z"), row.getCells());
    }

    @Test
    public void testBareRowIdRemovesRow()
    {
        MorkTable table = tables("{1 [1(a=x)] [2(a=y)] 1 }").get("1:c");
        assertThat(table.getRows().keySet(), contains("2"));

        table = tables("{1 [1:x(a=x)] 1:x }").get("1:c");
        assertTrue(table.getRows().isEmpty());
    }

    @Test
    public void testRemovingAbsentRowIsHarmless()
    {
        MorkTable table = tables("{1 5 [1(a=x)]}").get("1:c");
        assertThat(table.getRows().keySet(), contains("1"));
    }

    @Test
    public void testNonHexTableId()
    {
        InvalidIdentifierException e = error("{1g[1(a=b)]}", InvalidIdentifierException.class);
        assertEquals("1g", e.getText());
        assertEquals(1, e.getPosition().getColumn());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{1 [zz(a=b)]}",
        "{1 [1(a=b)] xyz }",
        "{1 [1(a=b)] 1:s 2g }",
    })
    public void testNonHexRowIds(String text)
    {
        error(text, InvalidIdentifierException.class);
    }

    @Test
    public void testTopLevelRowIsDiscarded()
    {
        Map<String, MorkTable> tables = tables("[1(a=x)]{1[1(a=y)]}");
        assertThat(tables.keySet(), contains("1:c"));
        assertEquals("y", cell(tables, "1:c", "1", "a"));
    }

    @Test
    public void testTopLevelRowReferencesAreChecked()
    {
        error("[1(a^80)]", UnresolvedReferenceException.class);
    }

    @Test
    public void testDictNamespaceFromMetadict()
    {
        Map<String, MorkTable> tables = tables("< <(a=c)> (80=Name)> {1[1(^80=Bob)]}");
        assertEquals("Bob", cell(tables, "1:c", "1", "Name"));

        // defined in "c" only
        error("< <(a=c)> (80=Name)> {1[1(x^80)]}", UnresolvedReferenceException.class);
    }

    @Test
    public void testLiteralsAreDecoded()
    {
        assertEquals("x)y", cell(tables("{1[1(a=x\\)y)]}"), "1:c", "1", "a"));
        assertEquals("caf\u00E9", cell(tables("{1[1(a=caf$C3$A9)]}"), "1:c", "1", "a"));
        assertEquals("caf\u00E9", cell(tables("{1[1(a=caf\u00E9)]}"), "1:c", "1", "a"));
    }

    @Test
    public void testCommittedGroupIsApplied()
    {
        Map<String, MorkTable> tables = tables(
            "@$${1{@ <(80=secret)> {5[1(a^80)]} @$$}1}@ {6[1(a^80)]}");
        assertThat(tables.keySet(), contains("5:c", "6:c"));
        assertEquals("secret", cell(tables, "5:c", "1", "a"));
        assertEquals("secret", cell(tables, "6:c", "1", "a"));
    }

    @Test
    public void testAbortedGroupLeavesNoTrace()
    {
        MorkParseResult result = parse(
            "{4[1(a=x)]} @$${1{@ <(80=secret)> {5[1(a^80)]} {4} @$$}~~}@ {6[1(a^80)]}");
        UnresolvedReferenceException e = (UnresolvedReferenceException) result.getError();
        assertEquals("80", e.getId());
        assertThat(result.getTables().keySet(), contains("4:c"));
        assertThat(result.getTables().get("4:c").getRows().keySet(), contains("1"));
    }

    @Test
    public void testAbortedGroupThenValidInput()
    {
        Map<String, MorkTable> tables = tables(
            "@$${1{@ {5[1(a=x)]} @$$}~~}@ {6[1(a=y)]}");
        assertThat(tables.keySet(), contains("6:c"));
    }

    @Test
    public void testGroupSeesEarlierDefinitions()
    {
        Map<String, MorkTable> tables = tables(
            "<(80=outer)> @$${1{@ {5[1(a^80)]} @$$}1}@");
        assertEquals("outer", cell(tables, "5:c", "1", "a"));
    }

    @Test
    public void testGroupReplacesTableOnCommit()
    {
        Map<String, MorkTable> tables = tables(
            "{5[1(a=old)]} @$${1{@ {5[2(a=new)]} @$$}1}@");
        assertThat(tables.get("5:c").getRows().keySet(), contains("2"));
    }

    @Test
    public void testTruncatedGroupIsDiscarded()
    {
        MorkParseResult result = parse("{1[1(a=x)]} @$${2{@ <(80=v)> {2[1(a^80)]}");
        assertTrue(result.isSuccess());
        assertThat(result.getTables().keySet(), contains("1:c"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{1[1(a=x)]} @$${2{@ {2[1(a=y)]",
        "{1[1(a=x)]} @$${2{@ {2[1(a=y)",
        "{1[1(a=x)]} @$${2{@ {2[1(a",
        "{1[1(a=x)]} @$${2{@ {2 {(k=v)",
        "{1[1(a=x)]} @$${2{@ <(80=v)",
        "{1[1(a=x)]} @$${2{@ <(80=",
        "{1[1(a=x)]} @$${2{@ [5(a=y)",
        "{1[1(a=x)]} @$${2{@ {2",
    })
    public void testGroupTruncatedInsideConstruct(String text)
    {
        MorkParseResult result = parse(text);
        assertNull(result.getError(), () -> "unexpected error: " + result.getError());
        assertThat(result.getTables().keySet(), contains("1:c"));
    }

    @Test
    public void testErrorInsideGroupIsNotHiddenByTruncation()
    {
        MorkParseResult result = parse("{1[1(a=x)]} @$${2{@ {2[1(a^99)]");
        assertThat(result.getError(), instanceOf(UnresolvedReferenceException.class));
        assertThat(result.getTables().keySet(), contains("1:c"));
    }

    @Test
    public void testEndOfInputAfterGroupIsStillAnError()
    {
        MorkSyntaxException e =
            error("@$${1{@ {2} @$$}1}@ {3[1(a=x)]", MorkSyntaxException.class);
        assertThat(e.getMessage(), containsString("unexpected end of input"));
    }

    @Test
    public void testLongScopeChain()
    {
        StringBuilder text = new StringBuilder("<(1=a)>{1[1(x=y)(z^1");
        for (int i = 0; i < 50000; i++)
        {
            text.append(":^1");
        }
        text.append(")]}");

        Map<String, MorkTable> tables = tables(text.toString());
        assertEquals("a", cell(tables, "1:c", "1", "z"));
        assertEquals("y", cell(tables, "1:c", "1", "x"));
    }

    @Test
    public void testScopeChainResolvesFromTheEnd()
    {
        // ^1 in a gives "ns", ^2 in ns gives "deep"
        Map<String, MorkTable> tables = tables(
            "<(1=ns)> < <(a=ns)> (2=deep)> {1[1(v^2:^1)]}");
        assertEquals("deep", cell(tables, "1:c", "1", "v"));
    }

    @Test
    public void testBrokenLinkInScopeChain()
    {
        UnresolvedReferenceException e =
            error("<(1=ns)> {1[1(v^2:^1)]}", UnresolvedReferenceException.class);
        assertEquals("2", e.getId());
        assertEquals("ns", e.getNamespace());
        assertEquals(15, e.getPosition().getColumn());
    }

    @Test
    public void testGroupIdMismatch()
    {
        MorkParseResult result = parse("{1[1(a=x)]} @$${1{@ {2[1(a=y)]} @$$}2}@");
        GroupMismatchException e = (GroupMismatchException) result.getError();
        assertEquals("1", e.getStartId());
        assertEquals("2", e.getEndId());
        assertThat(result.getTables().keySet(), contains("1:c"));
    }

    @Test
    public void testGroupIdsCompareIgnoringCase()
    {
        assertThat(tables("@$${aB{@ {2[1(a=y)]} @$$}Ab}@").keySet(), contains("2:c"));
    }

    @Test
    public void testGroupIdMismatchAllowedWhenNotValidating()
    {
        MorkParseResult result = parser("@$${1{@ {2[1(a=y)]} @$$}2}@", false).parse();
        assertTrue(result.isSuccess());
        assertThat(result.getTables().keySet(), contains("2:c"));
    }

    @Test
    public void testNestedGroupIsRejected()
    {
        MorkSyntaxException e = error("@$${1{@ @$${2{@ @$$}2}@ @$$}1}@", MorkSyntaxException.class);
        assertThat(e.getMessage(), containsString("nested groups are not supported"));
    }

    @Test
    public void testErrorKeepsEarlierTables()
    {
        MorkParseResult result = parse("{1[1(a=x)]} {2[1(a^99)]} {3[1(a=z)]}");
        assertThat(result.getError(), instanceOf(UnresolvedReferenceException.class));
        assertThat(result.getTables().keySet(), contains("1:c"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "<(80=x)",
        "<(80=x",
        "{1[1(a=x)]",
        "{1[1(a=x)",
        "{1 {(k=v)",
        "{1",
        "[1(a=x)",
    })
    public void testUnterminatedConstructs(String text)
    {
        MorkSyntaxException e = error(text, MorkSyntaxException.class);
        assertThat(e.getMessage(), containsString("unexpected end of input"));
        assertEquals("", e.getFoundToken());
    }

    @Test
    public void testUnexpectedToken()
    {
        MorkSyntaxException e = error(")", MorkSyntaxException.class);
        assertEquals(")", e.getFoundToken());
        assertThat(e.getMessage(),
                   containsString("expected a dict, table or group but found ')'"));
    }

    @Test
    public void testUnexpectedNameIsQuoted()
    {
        MorkSyntaxException e = error("{1 [1(a=x)(b c)]}", MorkSyntaxException.class);
        assertEquals("c", e.getFoundToken());
        assertThat(e.getMessage(), containsString("but found name \"c\""));
    }

    @Test
    public void testLexicalErrorStopsParse()
    {
        MorkParseResult result = parse("{1[1(a=x)]} #");
        MorkLexicalException e = (MorkLexicalException) result.getError();
        assertThat(e.getMessage(), containsString("bad character ['#']"));
        assertEquals(12, e.getPosition().getColumn());
        assertThat(result.getTables().keySet(), contains("1:c"));
    }

    @Test
    public void testGroupEndOutsideGroup()
    {
        error("@$$}1}@", MorkSyntaxException.class);
        error("@$$}~~}@", MorkSyntaxException.class);
    }

    @Test
    public void testParseOnlyOnce()
    {
        MorkParser parser = parser("{1}", true);
        assertThat(parser.parse().getTables().values(), hasSize(1));
        assertThrows(IllegalStateException.class, parser::parse);
    }

    @Test
    public void testEmptyTable()
    {
        MorkTable table = tables("{1}").get("1:c");
        assertThat(table.getRows().values(), empty());
        assertTrue(table.getMeta().isEmpty());
    }
}
