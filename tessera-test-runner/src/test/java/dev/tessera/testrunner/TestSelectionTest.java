package dev.tessera.testrunner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import static dev.tessera.testrunner.TestDefinitions.named;
import static dev.tessera.testrunner.TestDefinitions.names;

public class TestSelectionTest {

	@Test
	public void sortsByNameWithoutFilterOrShard() {
		var selection = new TestSelection(null, null);
		var selected = selection.select(named("b.Second", "a.First", "B.Upper", "a.Firsts"));

		Assertions.assertEquals(List.of("B.Upper", "a.First", "a.Firsts", "b.Second"), names(selected));
		Assertions.assertEquals(4, selection.count());
	}

	@Test
	public void nameFilterMustMatchWholeName() {
		var selection = new TestSelection(Pattern.compile("com\\.example\\.Foo"), null);
		var selected = selection.select(named("com.example.Foo", "com.example.FooTest", "x.com.example.Foo"));

		Assertions.assertEquals(List.of("com.example.Foo"), names(selected));
	}

	@Test
	public void filteredOutTestsDoNotConsumeOrdinals() {
		var selection = new TestSelection(Pattern.compile(".*Test"), new ShardSpec(0, 2));
		var selected = selection.select(named("a.ATest", "b.Helper", "c.CTest", "d.Helper", "e.ETest", "f.FTest"));

		// ordinals: ATest=1, CTest=2, ETest=3, FTest=4
		Assertions.assertEquals(List.of("c.CTest", "f.FTest"), names(selected));
		Assertions.assertEquals(4, selection.count());
	}

	@Test
	public void filterMatchingNothingSelectsNothing() {
		var selection = new TestSelection(Pattern.compile("nothing"), new ShardSpec(0, 1));

		Assertions.assertTrue(selection.select(named("a", "b", "c")).isEmpty());
		Assertions.assertEquals(0, selection.count());
	}

	@Test
	public void shardsFormDisjointCoverOfSortedTests() {
		var tests = named("k", "c", "a", "j", "e", "b", "h", "d", "i", "g", "f");
		var expected = names(new TestSelection(null, null).select(tests));

		for(int total = 1; total <= 5; ++total) {
			var union = new ArrayList<String>();
			for(int index = 0; index < total; ++index) {
				union.addAll(names(new TestSelection(null, new ShardSpec(index, total)).select(tests)));
			}

			Assertions.assertEquals(expected.size(), union.size(), "total " + total);
			Assertions.assertEquals(expected, union.stream().sorted().toList(), "total " + total);
		}
	}

	@Test
	public void shardOrdinalsStartAtOne() {
		var tests = named("a", "b", "c", "d");

		Assertions.assertEquals(List.of("b", "d"), names(new TestSelection(null, new ShardSpec(0, 2)).select(tests)));
		Assertions.assertEquals(List.of("a", "c"), names(new TestSelection(null, new ShardSpec(1, 2)).select(tests)));
	}

	@Test
	public void counterContinuesAcrossFrameworks() {
		var selection = new TestSelection(null, new ShardSpec(1, 2));

		var first = selection.select(named("b", "a", "c"));
		var second = selection.select(named("e", "d"));

		Assertions.assertEquals(List.of("a", "c"), names(first));
		// a per-framework counter would have picked "d" here
		Assertions.assertEquals(List.of("e"), names(second));
		Assertions.assertEquals(5, selection.count());
	}

	@Test
	public void selectionIsReproducible() {
		var tests = named("q", "w", "e", "r", "t", "y");
		var shard = new ShardSpec(2, 3);

		var reversed = new ArrayList<>(tests);
		Collections.reverse(reversed);

		var first = new TestSelection(Pattern.compile("[^t]"), shard).select(tests);
		var second = new TestSelection(Pattern.compile("[^t]"), shard).select(reversed);

		Assertions.assertEquals(first, second);
	}

	@Test
	public void emptyInputIsEmptySelection() {
		Assertions.assertTrue(new TestSelection(null, new ShardSpec(0, 3)).select(List.of()).isEmpty());
	}
}
