/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.yahoo.vmap.RegionArray.NIL;

public class RegionTreeTest {

    private static final long PAGE = 0x1000;

    private RegionTree tree;

    @Before
    public void setup() {
        tree = new RegionTree(new RegionArray(4));
    }

    private int insertPage(long pageNumber) {
        long start = pageNumber * PAGE;
        return tree.insert(start, start + PAGE, pageNumber);
    }

    private List<Long> starts() {
        List<Long> starts = new ArrayList<>();
        tree.forEach((start, end, payload) -> starts.add(start));
        return starts;
    }

    private static double maxHeight(int n) {
        return 2 * Math.log(n + 1) / Math.log(2);
    }

    @Test
    public void emptyTree() {
        Assert.assertTrue(tree.isEmpty());
        Assert.assertEquals(NIL, tree.first());
        Assert.assertEquals(NIL, tree.findContaining(0x1000));
        Assert.assertEquals(0x1000, tree.findFirstFit(PAGE, 0x1000));
        Assert.assertEquals(0x4000, tree.largestGap(0x1000, 0x5000));
        Assert.assertEquals(1, tree.validate());
    }

    @Test
    public void ascendingInsertionsStayBalanced() {
        int n = 1000;
        for (int i = 1; i <= n; i++) {
            insertPage(i);
            tree.validate();
        }
        Assert.assertEquals(n, tree.size());
        Assert.assertTrue(tree.validate() <= maxHeight(n));
        List<Long> starts = starts();
        for (int i = 0; i < n; i++) {
            Assert.assertEquals((i + 1) * PAGE, (long) starts.get(i));
        }
    }

    @Test
    public void descendingInsertionsStayBalanced() {
        int n = 1000;
        for (int i = n; i >= 1; i--) {
            insertPage(i);
        }
        tree.validate();
        Assert.assertEquals(PAGE, tree.start(tree.first()));
        Assert.assertEquals(n, starts().size());
    }

    @Test
    public void rotationsKeepOrder() {
        insertPage(2);
        insertPage(1);
        insertPage(3);
        int root = tree.getRoot();
        Assert.assertEquals(2 * PAGE, tree.start(root));

        tree.rotateLeft(root);
        int newRoot = tree.getRoot();
        Assert.assertEquals(3 * PAGE, tree.start(newRoot));
        Assert.assertEquals(root, tree.getArray().left(newRoot));
        Assert.assertEquals(newRoot, tree.getArray().parent(root));
        Assert.assertEquals(List.of(PAGE, 2 * PAGE, 3 * PAGE), starts());

        tree.rotateRight(newRoot);
        Assert.assertEquals(root, tree.getRoot());
        Assert.assertEquals(NIL, tree.getArray().parent(root));
        Assert.assertEquals(List.of(PAGE, 2 * PAGE, 3 * PAGE), starts());
        tree.validate();
    }

    @Test
    public void successorIsLeftmostOfRightSubtree() {
        for (int i = 1; i <= 7; i++) {
            insertPage(i);
        }
        int root = tree.getRoot();
        int successor = tree.successorOf(root);
        Assert.assertEquals(tree.start(root) + PAGE, tree.start(successor));
        Assert.assertEquals(successor, tree.next(root));
    }

    @Test
    public void deleteWithTwoChildrenMovesTheSuccessor() {
        for (int i = 1; i <= 7; i++) {
            insertPage(i);
        }
        int root = tree.getRoot();
        long rootStart = tree.start(root);
        int successor = tree.successorOf(root);
        long successorStart = tree.start(successor);
        long successorPayload = tree.payload(successor);

        int unlinked = tree.delete(root);
        tree.release(unlinked);

        Assert.assertEquals(successor, unlinked);
        Assert.assertEquals(successorStart, tree.start(root));
        Assert.assertEquals(successorPayload, tree.payload(root));
        Assert.assertEquals(NIL, tree.findContaining(rootStart));
        Assert.assertEquals(root, tree.findContaining(successorStart));
        Assert.assertEquals(6, tree.size());
        tree.validate();
    }

    @Test
    public void deleteLeafAndRoot() {
        int only = insertPage(5);
        Assert.assertEquals(only, tree.delete(only));
        tree.release(only);
        Assert.assertTrue(tree.isEmpty());
        tree.validate();

        int a = insertPage(1);
        insertPage(2);
        Assert.assertEquals(a, tree.delete(a));
        tree.release(a);
        Assert.assertEquals(List.of(2 * PAGE), starts());
        tree.validate();
    }

    @Test
    public void findContainingResolvesInteriorAddresses() {
        tree.insert(0x1000, 0x3000, 100);
        tree.insert(0x5000, 0x6000, 200);

        Assert.assertEquals(100, tree.payload(tree.findContaining(0x1000)));
        Assert.assertEquals(100, tree.payload(tree.findContaining(0x2FFF)));
        Assert.assertEquals(NIL, tree.findContaining(0x3000));
        Assert.assertEquals(NIL, tree.findContaining(0x4FFF));
        Assert.assertEquals(200, tree.payload(tree.findContaining(0x5800)));
        Assert.assertEquals(NIL, tree.findContaining(0x6000));
        Assert.assertEquals(NIL, tree.findContaining(0x0));
    }

    @Test
    public void firstFitTakesTheLowestHole() {
        tree.insert(0x2000, 0x3000, 0);
        tree.insert(0x5000, 0x6000, 0);
        tree.insert(0x9000, 0xA000, 0);

        // hole before the first region
        Assert.assertEquals(0x1000, tree.findFirstFit(0x1000, 0x1000));
        // [0x3000, 0x5000) is the first hole of two pages
        Assert.assertEquals(0x3000, tree.findFirstFit(0x2000, 0x1000));
        // only [0x6000, 0x9000) holds three pages
        Assert.assertEquals(0x6000, tree.findFirstFit(0x3000, 0x1000));
        // nothing between regions, after the last one
        Assert.assertEquals(0xA000, tree.findFirstFit(0x4000, 0x1000));
        Assert.assertEquals(0x3000, tree.largestGap(0x1000, 0xB000));
        Assert.assertEquals(0x6000, tree.largestGap(0x1000, 0x10000));
    }

    // Reference first-fit: an ordered walk tracking the end of the previous region
    private long scanFirstFit(long size, long lowerBound) {
        long candidate = lowerBound;
        for (int n = tree.first(); n != NIL; n = tree.next(n)) {
            if (candidate + size <= tree.start(n)) {
                return candidate;
            }
            candidate = tree.end(n);
        }
        return candidate;
    }

    @Test
    public void randomWorkloadKeepsInvariants() {
        Random random = new Random(17);
        int pages = 512;
        List<Long> free = new ArrayList<>();
        for (long p = 1; p <= pages; p++) {
            free.add(p);
        }
        Collections.shuffle(free, random);
        List<Long> live = new ArrayList<>();

        for (int step = 0; step < 5000; step++) {
            boolean insert = live.isEmpty() || (!free.isEmpty() && random.nextInt(100) < 55);
            if (insert) {
                long page = free.remove(free.size() - 1);
                insertPage(page);
                live.add(page);
            } else {
                long page = live.remove(random.nextInt(live.size()));
                int node = tree.findContaining(page * PAGE + random.nextInt((int) PAGE));
                Assert.assertNotEquals(NIL, node);
                Assert.assertEquals(page * PAGE, tree.start(node));
                tree.release(tree.delete(node));
                free.add(page);
                Collections.swap(free, free.size() - 1, random.nextInt(free.size()));
            }

            int blackHeight = tree.validate();
            Assert.assertEquals(live.size(), tree.size());
            Assert.assertTrue(blackHeight <= maxHeight(live.size()) + 1);

            long size = (1 + random.nextInt(4)) * PAGE;
            Assert.assertEquals(scanFirstFit(size, PAGE), tree.findFirstFit(size, PAGE));
        }
    }

    @Test
    public void clearEmptiesTheTree() {
        for (int i = 1; i <= 10; i++) {
            insertPage(i);
        }
        tree.clear();
        Assert.assertTrue(tree.isEmpty());
        Assert.assertEquals(0, tree.size());
        tree.validate();
        insertPage(3);
        Assert.assertEquals(List.of(3 * PAGE), starts());
    }
}
