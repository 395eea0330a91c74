/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.control;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.cloudway.combinator.data.Seq;
import com.cloudway.combinator.data.Tuple;
import com.cloudway.combinator.input.Input;
import com.cloudway.combinator.parser.Parser;
import com.cloudway.combinator.parser.Parsers;
import com.cloudway.combinator.parser.Reply;
import static com.cloudway.combinator.control.Syntax.*;
import static com.cloudway.combinator.parser.Parsers.*;

// @formatter:off
public class SyntaxTest
{
    private static final CharMatcher LOWER = CharMatcher.inRange('a', 'z');

    private static final Parser<Character, Character> item = item();

    private static final Parser<Character, String> IDENT =
        map(oneOrMore(sat(c -> LOWER.matches(c))), cs -> cs.show(Integer.MAX_VALUE, "", "", ""));

    private static <A> Reply<Character, A> reply(A value, String rest) {
        return Reply.of(value, Input.of(rest));
    }

    @Test
    public void do_chain_expands_to_bind() {
        Parser<Character, String> kv =
            do_(IDENT,        k ->
            do_(token('='),   () ->
            do_(IDENT,        v ->
            do_(Parsers.<Character, String>result(k + ":" + v)))));

        assertEquals(Seq.of(reply("key:value", ";")), kv.parse(Input.of("key=value;")));
        assertTrue(kv.parse(Input.of("key:value")).isEmpty());
    }

    @Test
    public void choice_is_deterministic() {
        Parser<Character, String> p = choice(string("ab"), string("a"));
        assertEquals(Seq.of(reply("ab", "c")), p.parse(Input.of("abc")));
        assertEquals(Seq.of(reply("a", "c")), p.parse(Input.of("ac")));
    }

    @Test
    public void named_bindings_are_visible_in_body() {
        Parser<Character, Tuple<Character, Character>> p = Syntax.<Character>begin()
            .let("a", item)
            .let(IGNORE, token(','))
            .let("b", item)
            .returning(env -> Tuple.of(env.<Character>get("a"), env.<Character>get("b")));

        assertEquals(Seq.of(reply(Tuple.of('x', 'y'), "z")), p.parse(Input.of("x,yz")));
        assertTrue(p.parse(Input.of("xyz")).isEmpty());
    }

    @Test
    public void later_bindings_see_earlier_values() {
        Parser<Character, Character> twice = Syntax.<Character>begin()
            .let("c", item)
            .letWith("again", env -> token(env.<Character>get("c")))
            .returning(env -> env.<Character>get("again"));

        assertEquals(Seq.of(reply('x', "")), twice.parse(Input.of("xx")));
        assertTrue(twice.parse(Input.of("xy")).isEmpty());
    }

    @Test
    public void inner_binding_shadows_outer() {
        Parser<Character, Character> p = Syntax.<Character>begin()
            .let("x", item)
            .let("x", item)
            .returning(env -> env.<Character>get("x"));

        assertEquals(Seq.of(reply('b', "c")), p.parse(Input.of("abc")));
    }

    @Test
    public void ignored_values_are_not_recorded() {
        Parser<Character, Boolean> p = Syntax.<Character>begin()
            .ignore(item)
            .let(IGNORE, item)
            .returning(env -> env.contains(IGNORE));

        assertEquals(Seq.of(reply(false, "c")), p.parse(Input.of("abc")));
    }

    @Test
    public void empty_block_is_its_body() {
        Parser<Character, Character> block = Syntax.<Character>begin().in(env -> item);
        assertSame(item, block);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unbound_name_is_an_error() {
        Parser<Character, Character> p = Syntax.<Character>begin()
            .let("a", item)
            .returning(env -> env.<Character>get("b"));
        p.parse(Input.of("a")).isEmpty();
    }

    @Test
    public void block_keeps_every_interpretation() {
        Parser<Character, String> p = Syntax.<Character>begin()
            .let("x", plus(token('a'), result('-')))
            .let("y", item)
            .returning(env -> "" + env.<Character>get("x") + env.<Character>get("y"));

        assertEquals(Seq.of(reply("ab", ""), reply("-a", "b")), p.parse(Input.of("ab")));
    }

    @Test
    public void block_over_token_input() {
        List<String> words = Splitter.on(' ').omitEmptyStrings().splitToList("let  x = 42 ;");
        Parser<String, String> ident = sat(s -> LOWER.matchesAllOf(s));
        Parser<String, Integer> number = map(Parsers.<String>item(), s -> Integer.valueOf(s));

        Parser<String, Tuple<String, Integer>> binding = Syntax.<String>begin()
            .ignore(token("let"))
            .let("name", ident)
            .ignore(token("="))
            .let("value", number)
            .returning(env -> Tuple.of(env.<String>get("name"), env.<Integer>get("value")));

        Input<String> in = Input.of(words);
        assertEquals(Tuple.of("x", 42), parseUnique(skip(binding, token(";")), in));
    }

    @Test
    public void bindings_show_names_in_binding_order() {
        Bindings env = Bindings.empty().bind("a", 1).bind(IGNORE, 2).bind("b", "x");
        assertEquals("{(a,1), (b,x)}", env.toString());
        assertTrue(env.contains("a"));
        assertFalse(env.contains(IGNORE));
        assertEquals(Integer.valueOf(1), env.<Integer>get("a"));
    }
}
