package org.broadinstitute.refloci.index;

import org.broadinstitute.refloci.locus.Direction;
import org.broadinstitute.refloci.locus.Locus;
import org.broadinstitute.refloci.testutils.RefLociBaseTest;
import org.broadinstitute.refloci.utils.Interval;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.*;
import java.util.stream.Collectors;

public final class ContigLocusIndexUnitTest extends RefLociBaseTest {

    @DataProvider(name = "loci")
    public Object[][] loci() {
        final Locus a = new Locus("chr8", 100, 150);
        final Locus b = new Locus("chr8", 160, 175);
        final Locus c = new Locus("chr8", 180, 200);
        final Locus big = new Locus("chr8", 0, 1000);
        final Locus point = new Locus("chr8", 170, 170);
        return new Object[][]{
                {Arrays.asList(a, b, c), new Interval(140, 170), Arrays.asList(a, b)},
                {Arrays.asList(a, b, c), new Interval(175, 180), Collections.emptyList()},
                {Arrays.asList(a, b, c), new Interval(174, 181), Arrays.asList(b, c)},
                {Arrays.asList(c, big, a), new Interval(500, 600), Collections.singletonList(big)},
                {Arrays.asList(a, point, b), new Interval(165, 175), Arrays.asList(b, point)},
                {Arrays.asList(a, point, b), new Interval(170, 175), Collections.singletonList(b)},
                {Collections.emptyList(), new Interval(0, 10), Collections.emptyList()},
        };
    }

    @Test(dataProvider = "loci")
    public void testOverlap(final List<Locus> loci, final Interval query, final List<Locus> expected) {
        final ContigLocusIndex index = new ContigLocusIndex(loci);
        Assert.assertEquals(index.getOverlapping(query), expected);
        Assert.assertEquals(index.getOverlappingIgnoringIndex(query), expected);
    }

    @Test
    public void testManyOverlaps() {
        final List<Locus> loci = new ArrayList<>();
        for (int i = 0; i < 10_000; i += 10) {
            loci.add(new Locus("chr1", i, i + 20));
        }
        final ContigLocusIndex index = new ContigLocusIndex(loci, 10, 4);
        Assert.assertEquals(index.size(), 1000);
        Assert.assertEquals(index.getChromosome(), "chr1");
        // [5000, 5001) is covered by [4990, 5010) and [5000, 5020)
        Assert.assertEquals(index.getOverlapping(new Interval(5000, 5001)),
                Arrays.asList(new Locus("chr1", 4990, 5010), new Locus("chr1", 5000, 5020)));
    }

    @DataProvider(name = "bucketSizes")
    public Object[][] bucketSizes() {
        return new Object[][]{
                {1000, 32},
                {10, 1},
                {1, 1},
                {100_000, 2},
        };
    }

    @Test(dataProvider = "bucketSizes")
    public void testAgainstBruteForce(final int targetBuckets, final int minBucketSize) {
        final Random rng = new Random(targetBuckets * 31 + minBucketSize);
        final List<Locus> loci = randomLoci(rng, 3000, Collections.singletonList("chr1"), 100_000, 2_000);
        // a few long ones so that the reach array matters
        loci.add(new Locus("chr1", 10, 90_000));
        loci.add(new Locus("chr1", 50_000, 50_000));
        final ContigLocusIndex index = new ContigLocusIndex(loci, targetBuckets, minBucketSize);

        for (int i = 0; i < 300; i++) {
            final int start = rng.nextInt(105_000) - 2_000;
            final Interval query = new Interval(start, start + rng.nextInt(3_000));

            assertSameElements(index.getOverlapping(query),
                    filter(loci, l -> l.getInterval().overlaps(query)), "overlap " + query);
            assertSameElements(index.getContained(query),
                    filter(loci, l -> query.contains(l.getInterval())), "contained " + query);
            assertSameElements(index.getContaining(query),
                    filter(loci, l -> l.getInterval().contains(query)), "containing " + query);

            final int position = query.getStart();
            assertNearest(index.nearest(position, Direction.DOWNSTREAM),
                    loci.stream().filter(l -> l.getStart() >= position).mapToInt(Locus::getStart).min(), true);
            assertNearest(index.nearest(position, Direction.UPSTREAM),
                    loci.stream().filter(l -> l.getEnd() <= position).mapToInt(Locus::getEnd).max(), false);

            final List<Locus> up = index.getUpstreamOf(position, 5, 1_000);
            Assert.assertEquals(up.size(), Math.min(5, filter(loci, l -> l.getEnd() <= position && position - l.getEnd() <= 1_000).size()));
            for (int j = 1; j < up.size(); j++) {
                Assert.assertTrue(up.get(j - 1).getEnd() >= up.get(j).getEnd(), "upstream loci are nearest first");
            }
            final List<Locus> down = index.getDownstreamOf(position, 5, 1_000);
            Assert.assertEquals(down.size(), Math.min(5, filter(loci, l -> l.getStart() >= position && l.getStart() - position <= 1_000).size()));
            for (int j = 1; j < down.size(); j++) {
                Assert.assertTrue(down.get(j - 1).getStart() <= down.get(j).getStart(), "downstream loci are nearest first");
            }
        }
    }

    private static void assertNearest(final Optional<Locus> actual, final OptionalInt expectedEdge, final boolean downstream) {
        Assert.assertEquals(actual.isPresent(), expectedEdge.isPresent());
        if (actual.isPresent()) {
            Assert.assertEquals(downstream ? actual.get().getStart() : actual.get().getEnd(), expectedEdge.getAsInt());
        }
    }

    private static List<Locus> filter(final List<Locus> loci, final java.util.function.Predicate<Locus> predicate) {
        return loci.stream().filter(predicate).collect(Collectors.toList());
    }

    @Test
    public void testNearest() {
        final Locus a = new Locus("chr8", 100, 150);
        final Locus b = new Locus("chr8", 160, 175);
        final Locus c = new Locus("chr8", 180, 200);
        final ContigLocusIndex index = new ContigLocusIndex(Arrays.asList(c, a, b));

        Assert.assertEquals(index.nearest(205, Direction.UPSTREAM), Optional.of(c));
        Assert.assertEquals(index.nearest(200, Direction.UPSTREAM), Optional.of(c));
        Assert.assertEquals(index.nearest(199, Direction.UPSTREAM), Optional.of(b));
        Assert.assertEquals(index.nearest(99, Direction.UPSTREAM), Optional.empty());
        Assert.assertEquals(index.nearest(0, Direction.DOWNSTREAM), Optional.of(a));
        Assert.assertEquals(index.nearest(160, Direction.DOWNSTREAM), Optional.of(b));
        Assert.assertEquals(index.nearest(181, Direction.DOWNSTREAM), Optional.empty());
    }

    @Test
    public void testNearestTies() {
        final Locus shortOne = new Locus("chr1", 100, 110);
        final Locus longOne = new Locus("chr1", 100, 300);
        final Locus endsLate = new Locus("chr1", 50, 300);
        final ContigLocusIndex index = new ContigLocusIndex(Arrays.asList(longOne, endsLate, shortOne));

        Assert.assertEquals(index.nearest(100, Direction.DOWNSTREAM).get(), shortOne);
        Assert.assertEquals(index.nearest(300, Direction.UPSTREAM).get(), longOne);
    }

    @Test
    public void testNeighborLimits() {
        final List<Locus> loci = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            loci.add(new Locus("chr1", i * 100, i * 100 + 50));
        }
        final ContigLocusIndex index = new ContigLocusIndex(loci);

        Assert.assertEquals(index.getUpstreamOf(500, 2, 1_000_000),
                Arrays.asList(new Locus("chr1", 400, 450), new Locus("chr1", 300, 350)));
        Assert.assertEquals(index.getUpstreamOf(500, 100, 100),
                Collections.singletonList(new Locus("chr1", 400, 450)));
        Assert.assertEquals(index.getDownstreamOf(450, 3, 150),
                Arrays.asList(new Locus("chr1", 500, 550), new Locus("chr1", 600, 650)));
        Assert.assertTrue(index.getDownstreamOf(450, 0, 150).isEmpty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMixedChromosomes() {
        new ContigLocusIndex(Arrays.asList(new Locus("chr1", 0, 1), new Locus("chr2", 0, 1)));
    }

    @Test
    public void testIterationIsSorted() {
        final Random rng = new Random(3);
        final List<Locus> loci = randomLoci(rng, 500, Collections.singletonList("chr5"), 10_000, 100);
        final ContigLocusIndex index = new ContigLocusIndex(loci);
        final List<Locus> iterated = new ArrayList<>();
        index.forEach(iterated::add);
        final List<Locus> sorted = new ArrayList<>(loci);
        Collections.sort(sorted);
        Assert.assertEquals(iterated, sorted);

        final ListIterator<Locus> it = index.listIterator();
        Assert.assertFalse(it.hasPrevious());
        final Locus first = it.next();
        Assert.assertTrue(it.hasPrevious());
        Assert.assertEquals(it.previous(), first);
    }
}
