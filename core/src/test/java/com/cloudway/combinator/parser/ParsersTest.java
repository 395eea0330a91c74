/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

import java.util.HashSet;
import java.util.concurrent.atomic.AtomicInteger;

import org.jmock.Expectations;
import org.jmock.api.Action;
import org.jmock.api.Invocation;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.jmock.lib.action.CustomAction;
import org.junit.Rule;
import org.junit.Test;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.cloudway.combinator.data.Seq;
import com.cloudway.combinator.data.Tuple;
import com.cloudway.combinator.input.Input;
import static com.cloudway.combinator.parser.Parsers.*;

// @formatter:off
public class ParsersTest
{
    @Rule
    public final JUnitRuleMockery context = new JUnitRuleMockery();

    private final Parser<Character, Character> item = item();

    static <A> Reply<Character, A> reply(A value, String rest) {
        return Reply.of(value, Input.of(rest));
    }

    @Test
    public void item_consumes_one_element() {
        assertEquals(Seq.of(reply('f', "oo")), item.parse(Input.of("foo")));
        assertEquals(Seq.nil(), item.parse(Input.of("")));
    }

    @Test
    public void result_consumes_nothing() {
        Parser<Character, Integer> p = result(42);
        Input<Character> in = Input.of("foo");
        Seq<Reply<Character, Integer>> replies = p.parse(in);

        assertEquals(Seq.of(reply(42, "foo")), replies);
        assertSame(in, replies.head().rest());
    }

    @Test
    public void fail_has_no_replies() {
        Parser<Character, Integer> p = fail();
        assertTrue(p.parse(Input.of("foo")).isEmpty());
        assertTrue(p.parse(Input.of("")).isEmpty());
    }

    @Test
    public void bind_passes_value_to_continuation() {
        Parser<Character, Seq<Object>> tagged = bind(item, c -> result(Seq.<Object>of(":char", c)));
        assertEquals(Seq.of(reply(Seq.<Object>of(":char", 'f'), "oo")), tagged.parse(Input.of("foo")));
    }

    @Test
    public void fail_annihilates_bind() {
        Parser<Character, Character> f = fail();
        Parser<Character, String> left = bind(f, c -> result("x"));
        Parser<Character, String> right = bind(item, c -> fail());

        assertTrue(left.parse(Input.of("abc")).isEmpty());
        assertTrue(right.parse(Input.of("abc")).isEmpty());
    }

    @Test
    public void zero_or_more_is_greedy() {
        Parser<Character, Seq<Character>> as = zeroOrMore(token('a'));

        assertEquals(Seq.of(reply(Seq.of('a', 'a', 'a', 'a'), "b")), as.parse(Input.of("aaaab")));
        assertEquals(Seq.of(reply(Seq.nil(), "bbbba")), as.parse(Input.of("bbbba")));
    }

    @Test
    public void plus_keeps_replies_of_both_sides_in_order() {
        Parser<Character, Object> twoItems = pair(item, item).map(t -> t);
        Parser<Character, Object> oneItem = item.map(c -> c);
        Parser<Character, Object> both = plus(twoItems, oneItem);

        assertEquals(Seq.of(reply(Tuple.of('a', 's'), "d"), reply('a', "sd")),
                     both.parse(Input.of("asd")));
    }

    @Test
    public void plus_has_fail_as_identity() {
        Parser<Character, Character> f = fail();
        Input<Character> in = Input.of("xyz");

        assertEquals(item.parse(in), plus(f, item).parse(in));
        assertEquals(item.parse(in), plus(item, f).parse(in));
    }

    @Test
    public void plus_is_associative() {
        Parser<Character, Character> a = item;
        Parser<Character, Character> b = result('z');
        Parser<Character, Character> c = token('x');

        for (String s : new String[] {"", "x", "xy", "abc"}) {
            Input<Character> in = Input.of(s);
            assertEquals(plus(plus(a, b), c).parse(in), plus(a, plus(b, c)).parse(in));
            assertEquals(plus(a, b, c).parse(in), plus(a, plus(b, c)).parse(in));
        }
    }

    @Test
    public void plus_is_commutative_up_to_order() {
        Parser<Character, Character> a = item;
        Parser<Character, Character> b = result('z');
        Input<Character> in = Input.of("abc");

        assertEquals(new HashSet<>(plus(a, b).parse(in).toList()),
                     new HashSet<>(plus(b, a).parse(in).toList()));
    }

    @Test
    public void plus_runs_right_side_on_demand() {
        AtomicInteger calls = new AtomicInteger();
        Parser<Character, Character> counted = input -> {
            calls.incrementAndGet();
            return item.parse(input);
        };

        Seq<Reply<Character, Character>> replies = plus(item, counted).parse(Input.of("ab"));
        assertEquals(Character.valueOf('a'), replies.head().value());
        assertEquals(0, calls.get());
        assertEquals(2, replies.size());
        assertEquals(1, calls.get());
    }

    @Test
    public void alt_runs_each_alternative_once_until_one_succeeds() {
        Parser<Character, Integer> p1 = mockParser("p1");
        Parser<Character, Integer> p2 = mockParser("p2");

        context.checking(new Expectations() {{
            exactly(3).of(p1).parse(with(any(Input.class)));
                will(returnValue(Seq.nil()));
            exactly(3).of(p2).parse(with(any(Input.class)));
                will(succeedWith(7));
        }});

        Parser<Character, Integer> p = alt(p1, p2);
        for (String s : new String[] {"", "x", "xyz"}) {
            Input<Character> in = Input.of(s);
            assertEquals(Seq.of(Reply.of(7, in)), p.parse(in));
        }
    }

    @Test
    public void alt_skips_later_alternatives_after_success() {
        Parser<Character, Integer> p1 = mockParser("p1");
        Parser<Character, Integer> p2 = mockParser("p2");

        context.checking(new Expectations() {{
            oneOf(p1).parse(with(any(Input.class)));
                will(succeedWith(1));
            never(p2).parse(with(any(Input.class)));
        }});

        Input<Character> in = Input.of("abc");
        assertEquals(Seq.of(Reply.of(1, in)), alt(p1, p2).parse(in));
    }

    @Test
    public void alt_returns_all_replies_of_the_winner() {
        Parser<Character, Character> ambiguous = plus(item, result('-'));
        Parser<Character, Character> p = alt(token('x'), ambiguous, item);

        assertEquals(Seq.of(reply('a', "b"), reply('-', "ab")), p.parse(Input.of("ab")));
        assertEquals(Seq.of(reply('x', "y")), p.parse(Input.of("xy")));
        assertEquals(Seq.of(reply('-', "")), p.parse(Input.of("")));
    }

    @Test
    public void alt_without_alternatives_fails() {
        Parser<Character, Character> p = alt();
        assertTrue(p.parse(Input.of("abc")).isEmpty());
    }

    @Test
    public void not_never_consumes_input() {
        Parser<Character, Boolean> notA = notP(token('a'));
        Input<Character> in = Input.of("bcd");
        Seq<Reply<Character, Boolean>> replies = notA.parse(in);

        assertEquals(Seq.of(reply(true, "bcd")), replies);
        assertSame(in, replies.head().rest());
        assertTrue(notA.parse(Input.of("abc")).isEmpty());
        assertEquals(Seq.of(reply(true, "xz")), notP(string("xy")).parse(Input.of("xz")));
        assertEquals(Seq.of(reply(true, "")), notA.parse(Input.of("")));
    }

    @Test
    public void default_methods_delegate_to_combinators() {
        Parser<Character, String> p = item.bind(c -> token('b').map(d -> "" + c + d));
        assertEquals(Seq.of(reply("ab", "c")), p.parse(Input.of("abc")));

        assertEquals(Seq.of(reply('b', "")), item.then(item).parse(Input.of("ab")));
        assertEquals(Seq.of(reply('a', "")), item.skip(item).parse(Input.of("ab")));
        assertEquals(Seq.of(reply('x', "")), token('y').or(token('x')).parse(Input.of("x")));
        assertEquals(2, token('x').plus(result('x')).parse(Input.of("x")).size());
    }

    @SuppressWarnings("unchecked")
    private Parser<Character, Integer> mockParser(String name) {
        return context.mock(Parser.class, name);
    }

    private static Action succeedWith(Object value) {
        return new CustomAction("succeed with " + value) {
            @Override
            public Object invoke(Invocation invocation) {
                Input<?> input = (Input<?>)invocation.getParameter(0);
                return Seq.of(Reply.of(value, input));
            }
        };
    }
}
