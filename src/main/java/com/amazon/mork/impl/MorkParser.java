// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import static com.amazon.mork.impl.MorkDictionaries.ATOM_NAMESPACE;
import static com.amazon.mork.impl.MorkDictionaries.COLUMN_NAMESPACE;

import com.amazon.mork.GroupMismatchException;
import com.amazon.mork.InvalidIdentifierException;
import com.amazon.mork.MorkLexicalException;
import com.amazon.mork.MorkOid;
import com.amazon.mork.MorkParseException;
import com.amazon.mork.MorkParseResult;
import com.amazon.mork.MorkRow;
import com.amazon.mork.MorkSyntaxException;
import com.amazon.mork.MorkTable;
import com.amazon.mork.SourcePosition;
import com.amazon.mork.UnresolvedReferenceException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recursive descent parser over the tokens of one {@link MorkLexer}, with a
 * single token of lookahead.
 * <pre>
 *    dict      ::= '&lt;' metadict? cell* '&gt;'
 *    metadict  ::= '&lt;' cell* '&gt;'
 *    cell      ::= '(' col slot ')'
 *    col       ::= ref(c) | NAME
 *    slot      ::= ref(a) | '=' LITERAL
 *    ref       ::= '^' HEXID (':' (NAME | ref))?
 *    row       ::= '[' oid(row scope) metarow? cell* ']'
 *    metarow   ::= '[' cell* ']'
 *    table     ::= '{' oid(c) metatable? (row | oid)* '}'
 *    metatable ::= '{' (cell | metarow)* '}'
 *    oid       ::= HEXID (':' (NAME | ref))?
 *    group     ::= GROUP_START (dict | row | table)* (GROUP_COMMIT | GROUP_ABORT | EOF)
 * </pre>
 * The input may end anywhere inside a group, even in the middle of a
 * table; the group is then dropped as if aborted and parsing succeeds.
 * Errors are sticky: the first one is recorded and from then on every
 * {@code expect} and every reference lookup is a no-op returning an empty
 * value, so the productions unwind without checking after each step.
 * Loops that peek must still test {@code _error} since a no-op does not
 * consume the token they are looking at.
 * <p>
 * A parser is good for one {@link #parse()}.
 */
final class MorkParser
{
    private static final Logger LOG = Logger.getLogger(MorkParser.class.getName());

    /** Metadict cell naming the namespace a dict defines its cells in. */
    static final String DICT_NAMESPACE_CELL = "a";

    /** returned by {@code expect} once an error is recorded */
    private static final MorkToken NO_TOKEN =
        new MorkToken(MorkTokenType.ERROR, "", SourcePosition.START);

    private final String            _source_name;
    private final MorkLexer         _lexer;
    private final LiteralDecoder    _decoder;
    private final boolean           _validate_group_ids;

    private MorkToken               _peeked;
    private MorkParseException      _error;
    private boolean                 _parsed;

    private MorkGroup               _open_group;
    /** set when the input ends inside {@link #_open_group} */
    private boolean                 _group_truncated;

    private final Map<String, MorkTable> _result = new LinkedHashMap<String, MorkTable>();

    /** where definitions and tables go; swapped for a group's buffers inside a group */
    private MorkDictionaries        _dictionaries = new MorkDictionaries();
    private Map<String, MorkTable>  _tables = _result;

    MorkParser(String sourceName, MorkLexer lexer, LiteralDecoder decoder,
               boolean validateGroupIds) {
        _source_name = sourceName;
        _lexer = lexer;
        _decoder = decoder;
        _validate_group_ids = validateGroupIds;
    }

    /**
     * Parses to the end of the input or the first error.
     *
     * @return the tables completed before parsing stopped and the error
     * that stopped it, if any.
     */
    MorkParseResult parse() {
        if (_parsed) {
            throw new IllegalStateException("parse() may only be called once");
        }
        _parsed = true;

        loop: for (;;) {
            MorkToken t = peek();
            switch (t.getType()) {
            case EOF:
                break loop;
            case LANGLE:
                parse_dict();
                break;
            case LSQUARE:
                discard_row();
                break;
            case LBRACE:
                store_table();
                break;
            case GROUP_START:
                parse_group();
                break;
            default:
                unexpected(next(), "a dict, table or group");
                break;
            }
            if (_error != null) {
                break;
            }
        }
        return new MorkParseResult(_source_name, _result, _error);
    }

    //
    //  token handling
    //
    private MorkToken peek() {
        if (_peeked == null) {
            _peeked = _lexer.nextToken();
        }
        return _peeked;
    }

    private boolean peek_is(MorkTokenType type) {
        return _error == null && peek().getType() == type;
    }

    private MorkToken next() {
        MorkToken t = peek();
        _peeked = null;
        return t;
    }

    /**
     * Consumes the next token if it has the expected type, otherwise
     * records an error.
     *
     * @return {@link #NO_TOKEN} if an error is recorded.
     */
    private MorkToken expect(MorkTokenType expected) {
        if (_error != null) {
            return NO_TOKEN;
        }
        MorkToken t = next();
        if (t.getType() != expected) {
            unexpected(t, expected.describe());
            return NO_TOKEN;
        }
        return t;
    }

    private void fail(MorkParseException e) {
        if (_error == null) {
            _error = e;
        }
    }

    private void unexpected(MorkToken t, String expected) {
        SourcePosition pos = t.getPosition();
        switch (t.getType()) {
        case ERROR:
            fail(new MorkLexicalException(_source_name, pos, t.getText()));
            break;
        case EOF:
            if (_open_group != null && _error == null) {
                _group_truncated = true;
            }
            fail(new MorkSyntaxException(_source_name, pos,
                     "unexpected end of input, expected " + expected, ""));
            break;
        default:
            fail(new MorkSyntaxException(_source_name, pos,
                     "expected " + expected + " but found " + describe(t),
                     t.getText()));
            break;
        }
    }

    private static String describe(MorkToken t) {
        switch (t.getType()) {
        case NAME:
        case LITERAL:
            return t.getType().describe() + " \"" + t.getText() + "\"";
        default:
            return t.getType().describe();
        }
    }

    //
    //  ids and references
    //
    private String expect_hex_id() {
        MorkToken t = expect(MorkTokenType.NAME);
        if (_error != null) {
            return "";
        }
        String id = t.getText();
        if (!MorkTokenConsts.isHexId(id)) {
            fail(new InvalidIdentifierException(_source_name, t.getPosition(), id));
            return "";
        }
        return id;
    }

    /**
     * @return the string stored for the id, or "" with an error recorded.
     */
    private String resolve(String id, String namespace, SourcePosition pos) {
        if (_error != null) {
            return "";
        }
        String value = _dictionaries.lookup(id, namespace);
        if (value == null) {
            fail(new UnresolvedReferenceException(_source_name, pos, id, namespace));
            return "";
        }
        return value;
    }

    /**
     * {@code ^id} or {@code ^id:scope}, resolved.  The scope may itself be a
     * reference, so {@code ^1:^2:^3:ns} is a chain resolved from the last
     * link back to the first.
     */
    private String parse_ref(String defaultNamespace) {
        List<MorkToken> carets = new ArrayList<MorkToken>();
        List<String> ids = new ArrayList<String>();
        String namespace = defaultNamespace;
        for (;;) {
            carets.add(expect(MorkTokenType.CARET));
            ids.add(expect_hex_id());
            if (!peek_is(MorkTokenType.COLON)) {
                break;
            }
            next();
            if (!peek_is(MorkTokenType.CARET)) {
                namespace = expect(MorkTokenType.NAME).getText();
                break;
            }
        }
        for (int i = ids.size() - 1; i >= 0; i--) {
            namespace = resolve(ids.get(i), namespace, carets.get(i).getPosition());
        }
        return namespace;
    }

    /** the part after the colon: a literal name or a reference to one */
    private String parse_scope(String defaultNamespace) {
        if (peek_is(MorkTokenType.CARET)) {
            return parse_ref(defaultNamespace);
        }
        return expect(MorkTokenType.NAME).getText();
    }

    private MorkOid parse_oid(String defaultScope) {
        String id = expect_hex_id();
        String scope = defaultScope;
        if (peek_is(MorkTokenType.COLON)) {
            next();
            scope = parse_scope(defaultScope);
        }
        return new MorkOid(id, scope);
    }

    /** rows in the table's row scope are keyed by the bare id */
    private static String row_key(MorkOid oid, String rowScope) {
        return oid.getScope().equals(rowScope) ? oid.getId() : oid.coalesce();
    }

    //
    //  cells
    //
    private void parse_cell(Map<String, String> cells) {
        expect(MorkTokenType.LPAREN);

        String column;
        if (peek_is(MorkTokenType.CARET)) {
            column = parse_ref(COLUMN_NAMESPACE);
        }
        else {
            column = expect(MorkTokenType.NAME).getText();
        }

        String value;
        if (peek_is(MorkTokenType.EQUAL)) {
            next();
            MorkToken literal = expect(MorkTokenType.LITERAL);
            value = (_error == null) ? _decoder.decode(literal.getText()) : "";
        }
        else {
            value = parse_ref(ATOM_NAMESPACE);
        }

        expect(MorkTokenType.RPAREN);
        if (_error == null) {
            cells.put(column, value);
        }
    }

    private Map<String, String> parse_cells() {
        Map<String, String> cells = new LinkedHashMap<String, String>();
        while (peek_is(MorkTokenType.LPAREN)) {
            parse_cell(cells);
        }
        return cells;
    }

    //
    //  dicts
    //
    /**
     * Cells are collected first and defined together after the closing
     * angle bracket, so a cell cannot refer to another cell of the same dict.
     */
    private void parse_dict() {
        expect(MorkTokenType.LANGLE);

        String namespace = ATOM_NAMESPACE;
        if (peek_is(MorkTokenType.LANGLE)) {
            String override = parse_metadict().get(DICT_NAMESPACE_CELL);
            if (override != null) {
                namespace = override;
            }
        }

        Map<String, String> cells = parse_cells();
        expect(MorkTokenType.RANGLE);

        if (_error == null) {
            for (Map.Entry<String, String> cell : cells.entrySet()) {
                _dictionaries.define(cell.getKey(), namespace, cell.getValue());
            }
        }
    }

    private Map<String, String> parse_metadict() {
        expect(MorkTokenType.LANGLE);
        Map<String, String> cells = parse_cells();
        expect(MorkTokenType.RANGLE);
        return cells;
    }

    //
    //  rows and tables
    //
    private MorkRow parse_row(String rowScope) {
        expect(MorkTokenType.LSQUARE);
        MorkOid oid = parse_oid(rowScope);
        MorkRow row = new MorkRow(row_key(oid, rowScope));

        if (peek_is(MorkTokenType.LSQUARE)) {
            for (Map.Entry<String, String> cell : parse_metarow().entrySet()) {
                row.putMeta(cell.getKey(), cell.getValue());
            }
        }
        for (Map.Entry<String, String> cell : parse_cells().entrySet()) {
            row.put(cell.getKey(), cell.getValue());
        }

        expect(MorkTokenType.RSQUARE);
        return row;
    }

    private Map<String, String> parse_metarow() {
        expect(MorkTokenType.LSQUARE);
        Map<String, String> cells = parse_cells();
        expect(MorkTokenType.RSQUARE);
        return cells;
    }

    /** a row outside any table has nowhere to go */
    private void discard_row() {
        MorkRow row = parse_row(COLUMN_NAMESPACE);
        if (_error == null && LOG.isLoggable(Level.FINE)) {
            LOG.fine(_source_name + ": discarding row " + row.getId() + " outside of a table");
        }
    }

    private void parse_metatable(MorkTable table) {
        expect(MorkTokenType.LBRACE);
        for (;;) {
            if (_error != null) {
                return;
            }
            MorkToken t = peek();
            switch (t.getType()) {
            case LPAREN:
                Map<String, String> cell = new LinkedHashMap<String, String>(2);
                parse_cell(cell);
                copy_meta(cell, table);
                break;
            case LSQUARE:
                copy_meta(parse_metarow(), table);
                break;
            case RBRACE:
                next();
                return;
            default:
                unexpected(next(), "a cell, metarow or '}'");
                break;
            }
        }
    }

    private static void copy_meta(Map<String, String> cells, MorkTable table) {
        for (Map.Entry<String, String> cell : cells.entrySet()) {
            table.putMeta(cell.getKey(), cell.getValue());
        }
    }

    /**
     * @return null if an error is recorded.
     */
    private MorkTable parse_table() {
        expect(MorkTokenType.LBRACE);
        MorkOid oid = parse_oid(COLUMN_NAMESPACE);
        MorkTable table = new MorkTable(oid);

        if (peek_is(MorkTokenType.LBRACE)) {
            parse_metatable(table);
        }
        String rowScope = table.getRowScope();

        for (;;) {
            if (_error != null) {
                return null;
            }
            MorkToken t = peek();
            switch (t.getType()) {
            case RBRACE:
                next();
                return table;
            case LSQUARE:
                MorkRow row = parse_row(rowScope);
                if (_error == null) {
                    table.putRow(row);
                }
                break;
            case NAME:
                // a bare row id cuts that row from the table
                MorkOid cut = parse_oid(rowScope);
                if (_error == null) {
                    table.removeRow(row_key(cut, rowScope));
                }
                break;
            default:
                unexpected(next(), "a row, row id or '}'");
                break;
            }
        }
    }

    /** a later table with the same id replaces the earlier one */
    private void store_table() {
        MorkTable table = parse_table();
        if (table != null && _error == null) {
            _tables.put(table.getId(), table);
        }
    }

    //
    //  groups
    //
    private void parse_group() {
        MorkToken start = expect(MorkTokenType.GROUP_START);
        if (_error != null) {
            return;
        }

        MorkGroup group = new MorkGroup(start.getGroupId(), _dictionaries);
        MorkDictionaries outerDictionaries = _dictionaries;
        Map<String, MorkTable> outerTables = _tables;
        _dictionaries = group.getDictionaries();
        _tables = group.getTables();
        _open_group = group;
        try {
            parse_group_body(group, outerTables);
        }
        finally {
            _dictionaries = outerDictionaries;
            _tables = outerTables;
            _open_group = null;
        }

        // a truncated group is treated as aborted, wherever the input ends
        if (_group_truncated) {
            _group_truncated = false;
            _error = null;
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(_source_name + ": input ends inside group " + group.getId()
                         + ", discarding it");
            }
        }
    }

    private void parse_group_body(MorkGroup group, Map<String, MorkTable> outerTables) {
        for (;;) {
            MorkToken t = peek();
            switch (t.getType()) {
            case EOF:
                _group_truncated = true;
                return;
            case LANGLE:
                parse_dict();
                break;
            case LSQUARE:
                discard_row();
                break;
            case LBRACE:
                store_table();
                break;
            case GROUP_COMMIT:
                MorkToken end = next();
                String endId = end.getGroupId();
                if (_validate_group_ids && !group.getId().equalsIgnoreCase(endId)) {
                    fail(new GroupMismatchException(_source_name, end.getPosition(),
                                                    group.getId(), endId));
                    return;
                }
                if (LOG.isLoggable(Level.FINER)) {
                    LOG.finer(_source_name + ": committing group " + group.getId() + " with "
                              + group.getDictionaries().size() + " alias(es) and "
                              + group.getTables().size() + " table(s)");
                }
                group.commitTo(outerTables);
                return;
            case GROUP_ABORT:
                next();
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine(_source_name + ": group " + group.getId() + " aborted");
                }
                return;
            case GROUP_START:
                next();
                fail(new MorkSyntaxException(_source_name, t.getPosition(),
                         "group " + t.getGroupId() + " starts inside group " + group.getId()
                         + "; nested groups are not supported",
                         t.getText()));
                return;
            default:
                unexpected(next(), "a dict, table or group end");
                break;
            }
            if (_error != null) {
                return;
            }
        }
    }
}
