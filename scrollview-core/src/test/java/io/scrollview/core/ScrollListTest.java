/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.scrollview.core;

import io.scrollview.core.cursor.ScrollCursor;
import io.scrollview.core.items.LogItem;
import io.scrollview.core.items.ScrollItem;
import io.scrollview.core.items.TextItem;
import io.scrollview.core.items.ToolItem;
import io.scrollview.core.text.TextLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ScrollList")
class ScrollListTest {

    /**
     * Log item with exactly {@code lines} lines at any width of at least 10 columns.
     */
    private static LogItem item(String id, int lines) {
        String text = IntStream.rangeClosed(1, lines)
            .mapToObj(i -> id + "-" + i)
            .collect(Collectors.joining("\n"));
        return new LogItem(id, text);
    }

    private static long totalRenders(List<ScrollItem> items) {
        return items.stream().mapToLong(ScrollItem::renderCount).sum();
    }

    private static List<ScrollItem> singleLineItems(int count) {
        List<ScrollItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(item("i" + i, 1));
        }
        return items;
    }

    @Nested
    @DisplayName("Bottom anchoring")
    class BottomAnchoringTest {

        @Test
        @DisplayName("should show the last four lines of 5/1/8 from item 2")
        void shouldAnchorFiveOneEight() {
            ScrollList list = new ScrollList(40, 4);
            list.setItems(List.of(item("a", 5), item("b", 1), item("c", 8)));

            list.gotoBottom();

            assertThat(list.cursor()).isEqualTo(new ScrollCursor(2, 4));
            assertThat(list.atBottom()).isTrue();
            assertThat(list.viewLines()).containsExactly("c-5", "c-6", "c-7", "c-8");
        }

        @Test
        @DisplayName("should follow fifty appends and stop following when disabled")
        void shouldFollowAppends() {
            ScrollList list = new ScrollList(40, 10);
            for (int i = 0; i < 50; i++) {
                list.appendItem(item("i" + i, 1));
                assertThat(list.atBottom()).as("after append %d", i).isTrue();
            }

            list.setAutoScroll(false);
            ScrollCursor before = list.cursor();
            list.appendItem(item("late", 1));

            assertThat(list.cursor()).isEqualTo(before);
            assertThat(list.atBottom()).isFalse();
        }

        @Test
        @DisplayName("should be at the bottom after gotoBottom for any viewport")
        void shouldAlwaysReachBottom() {
            Random random = new Random(11);
            for (int round = 0; round < 200; round++) {
                ScrollList list = new ScrollList(40, 1 + random.nextInt(30));
                list.setAutoScroll(false);
                int count = 1 + random.nextInt(25);
                for (int i = 0; i < count; i++) {
                    list.appendItem(item("r" + i, 1 + random.nextInt(6)));
                }

                list.gotoBottom();

                assertThat(list.atBottom()).isTrue();
            }
        }

        @Test
        @DisplayName("should treat an empty list as at the bottom")
        void shouldTreatEmptyAsBottom() {
            ScrollList list = new ScrollList(40, 10);

            list.gotoBottom();

            assertThat(list.atBottom()).isTrue();
            assertThat(list.cursor()).isEqualTo(ScrollCursor.TOP);
            assertThat(list.view()).isEmpty();
        }
    }

    @Nested
    @DisplayName("View")
    class ViewTest {

        @Test
        @DisplayName("should separate items with blank lines")
        void shouldSeparateItems() {
            ScrollList list = new ScrollList(40, 10);
            list.setItems(List.of(item("a", 1), item("b", 1), item("c", 1)));

            assertThat(list.viewLines()).containsExactly("a-1", "", "b-1", "", "c-1");
            assertThat(list.view()).isEqualTo("a-1\n\nb-1\n\nc-1");
        }

        @Test
        @DisplayName("should pack items without separators when disabled")
        void shouldPackWithoutSeparators() {
            ScrollList list = ScrollList.builder().withSize(40, 10).withItemSeparators(false).build();
            list.setItems(List.of(item("a", 1), item("b", 2)));

            assertThat(list.viewLines()).containsExactly("a-1", "b-1", "b-2");
        }

        @Test
        @DisplayName("should drop leading lines of the first item and cut the last")
        void shouldCutAtViewportEdges() {
            ScrollList list = ScrollList.builder().withSize(40, 4).withAutoScroll(false).build();
            list.setItems(List.of(item("a", 5), item("b", 5)));

            list.scrollBy(3);

            assertThat(list.viewLines()).containsExactly("a-4", "a-5", "", "b-1");
        }

        @Test
        @DisplayName("should only render items inside the viewport")
        void shouldRenderLazily() {
            ScrollList list = ScrollList.builder().withSize(40, 5).withAutoScroll(false).build();
            List<ScrollItem> items = singleLineItems(1000);
            list.setItems(items);

            list.view();
            list.view();

            assertThat(items.get(0).renderCount()).isEqualTo(1);
            assertThat(items.get(2).renderCount()).isEqualTo(1);
            assertThat(items.get(10).renderCount()).isZero();
            assertThat(items.get(999).renderCount()).isZero();
        }

        @Test
        @DisplayName("should mark the selected item's first visible line")
        void shouldMarkSelection() {
            ScrollList list = new ScrollList(40, 10);
            list.setItems(List.of(item("a", 1), item("b", 2)));

            list.setSelected(1);

            assertThat(list.selectedIndex()).isEqualTo(1);
            assertThat(list.viewLines()).containsExactly("a-1", "", "▸ b-1", "b-2");
        }

        @Test
        @DisplayName("should keep the marked line within the width")
        void shouldCutMarkedLine() {
            ScrollList list = new ScrollList(10, 5);
            list.setItems(List.of(new LogItem("a", "abcdefghij")));

            list.setSelected(0);

            assertThat(list.viewLines()).containsExactly("▸ abcdefg…");
            assertThat(list.viewLines()).allMatch(line -> TextLayout.displayWidth(line) <= 10);
        }

        @Test
        @DisplayName("should ignore selections outside the list")
        void shouldIgnoreInvalidSelection() {
            ScrollList list = new ScrollList(40, 10);
            list.setItems(List.of(item("a", 1)));

            list.setSelected(5);

            assertThat(list.selectedIndex()).isEqualTo(-1);
        }

        @Test
        @DisplayName("should map viewport rows back to items")
        void shouldHitTestRows() {
            ScrollList list = new ScrollList(40, 10);
            list.setItems(List.of(item("a", 1), item("b", 2), item("c", 1)));

            assertThat(list.itemIndexAtRow(0)).isEqualTo(0);
            assertThat(list.itemIndexAtRow(1)).isEqualTo(-1);
            assertThat(list.itemIndexAtRow(2)).isEqualTo(1);
            assertThat(list.itemIndexAtRow(3)).isEqualTo(1);
            assertThat(list.itemIndexAtRow(5)).isEqualTo(2);
            assertThat(list.itemIndexAtRow(6)).isEqualTo(-1);
            assertThat(list.itemIndexAtRow(-1)).isEqualTo(-1);
            assertThat(list.itemIndexAtRow(10)).isEqualTo(-1);
        }

        @Test
        @DisplayName("should produce nothing for a zero-height viewport")
        void shouldHandleZeroHeight() {
            ScrollList list = new ScrollList(40, 10);
            list.setItems(List.of(item("a", 3)));

            list.setHeight(-5);

            assertThat(list.height()).isZero();
            assertThat(list.viewLines()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Resizing")
    class ResizeTest {

        @Test
        @DisplayName("should re-layout lazily after a width change")
        void shouldRelayoutLazily() {
            ScrollList list = ScrollList.builder().withSize(40, 10).withAutoScroll(false).build();
            TextItem first = new TextItem("t1", "short");
            TextItem second = new TextItem("t2", "also short");
            list.setItems(List.of(first, second));
            list.view();
            assertThat(second.renderCount()).isEqualTo(1);

            list.setWidth(20);
            assertThat(second.renderCount()).isEqualTo(1);

            list.view();
            assertThat(second.renderCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should lay out only the visible items after a resize while following")
        void shouldResizeFollowingListLazily() {
            ScrollList list = ScrollList.builder().withSize(80, 10).withItemSeparators(false).build();
            List<ScrollItem> items = singleLineItems(1000);
            list.setItems(items);
            list.view();
            long before = totalRenders(items);

            list.setWidth(60);
            list.view();

            assertThat(totalRenders(items) - before).isEqualTo(10);
            assertThat(items.get(0).renderCount()).isEqualTo(1);
            assertThat(items.get(999).renderCount()).isEqualTo(2);
            assertThat(list.atBottom()).isTrue();
        }

        @Test
        @DisplayName("should answer position queries after a resize without laying out")
        void shouldKeepIndicatorsLazy() {
            ScrollList list = ScrollList.builder().withSize(80, 10).withItemSeparators(false).build();
            List<ScrollItem> items = singleLineItems(1000);
            list.setItems(items);
            list.gotoTop();
            list.setAutoScroll(false);
            list.view();
            list.totalLineCount();
            long before = totalRenders(items);

            list.setWidth(50);
            list.scrollPercent();
            list.atBottom();
            list.totalLineCount();
            list.firstVisibleLine();
            assertThat(totalRenders(items) - before).isZero();

            list.view();
            assertThat(totalRenders(items) - before).isEqualTo(10);
        }

        @Test
        @DisplayName("should re-anchor to the bottom when following")
        void shouldReanchorOnResize() {
            ScrollList list = new ScrollList(80, 3);
            list.appendItem(new TextItem("t", "one two three four five six seven eight nine ten"));
            assertThat(list.totalLineCount()).isEqualTo(1);

            list.setWidth(12);

            assertThat(list.totalLineCount()).isGreaterThan(3);
            assertThat(list.atBottom()).isTrue();
        }

        @Test
        @DisplayName("should clamp the cursor when items disappear")
        void shouldClampOnShrink() {
            ScrollList list = ScrollList.builder().withSize(40, 2).withAutoScroll(false).build();
            LogItem first = item("a", 3);
            list.setItems(List.of(first, item("b", 3)));
            list.scrollBy(4);
            assertThat(list.cursor()).isEqualTo(new ScrollCursor(1, 1));

            list.setItems(List.of(first));

            assertThat(list.cursor()).isEqualTo(new ScrollCursor(0, 1));
            assertThat(list.viewLines()).containsExactly("a-2", "a-3");
        }

        @Test
        @DisplayName("should treat negative sizes as zero")
        void shouldClampNegativeSizes() {
            ScrollList list = new ScrollList(40, 10);

            list.setSize(-1, -1);

            assertThat(list.width()).isZero();
            assertThat(list.height()).isZero();
        }
    }

    @Nested
    @DisplayName("Keyboard")
    class KeyboardTest {

        private ScrollList thirtyLines() {
            ScrollList list = ScrollList.builder()
                .withSize(40, 10)
                .withFocused(true)
                .withItemSeparators(false)
                .build();
            list.setItems(singleLineItems(30));
            return list;
        }

        @Test
        @DisplayName("should ignore keys while unfocused")
        void shouldIgnoreWhenUnfocused() {
            ScrollList list = thirtyLines();
            list.setFocused(false);

            assertThat(list.update(KeyPress.PAGE_UP)).isFalse();
            assertThat(list.cursor()).isEqualTo(new ScrollCursor(20, 0));
        }

        @Test
        @DisplayName("should page up and stop following")
        void shouldPageUp() {
            ScrollList list = thirtyLines();

            assertThat(list.update(KeyPress.PAGE_UP)).isTrue();
            assertThat(list.cursor()).isEqualTo(new ScrollCursor(10, 0));
            assertThat(list.isAutoScroll()).isFalse();

            list.update(KeyPress.PAGE_UP);
            list.update(KeyPress.PAGE_UP);
            assertThat(list.cursor()).isEqualTo(ScrollCursor.TOP);
        }

        @Test
        @DisplayName("should resume following when paging down onto the bottom")
        void shouldPageDown() {
            ScrollList list = thirtyLines();
            list.update(KeyPress.HOME);

            list.update(KeyPress.PAGE_DOWN);
            assertThat(list.cursor()).isEqualTo(new ScrollCursor(10, 0));
            assertThat(list.isAutoScroll()).isFalse();

            list.update(KeyPress.PAGE_DOWN);
            assertThat(list.cursor()).isEqualTo(new ScrollCursor(20, 0));
            assertThat(list.isAutoScroll()).isTrue();

            list.update(KeyPress.PAGE_DOWN);
            assertThat(list.cursor()).isEqualTo(new ScrollCursor(20, 0));
            assertThat(list.viewLines()).hasSize(10);
        }

        @Test
        @DisplayName("should stop scrolling down at the bottom-anchored cursor")
        void shouldCapScrollAtBottom() {
            ScrollList list = ScrollList.builder()
                .withSize(40, 5)
                .withItemSeparators(false)
                .build();
            list.setItems(List.of(item("a", 3), item("b", 12)));
            list.gotoTop();

            list.scrollBy(100);

            assertThat(list.cursor()).isEqualTo(new ScrollCursor(1, 7));
            assertThat(list.viewLines()).containsExactly("b-8", "b-9", "b-10", "b-11", "b-12");
            assertThat(list.atBottom()).isTrue();
        }

        @Test
        @DisplayName("should jump with home and end")
        void shouldJump() {
            ScrollList list = thirtyLines();

            assertThat(list.update(KeyPress.HOME)).isTrue();
            assertThat(list.cursor()).isEqualTo(ScrollCursor.TOP);
            assertThat(list.isAutoScroll()).isFalse();

            assertThat(list.update(KeyPress.END)).isTrue();
            assertThat(list.cursor()).isEqualTo(new ScrollCursor(20, 0));
            assertThat(list.isAutoScroll()).isTrue();
        }

        @Test
        @DisplayName("should leave other keys to the owner")
        void shouldNotConsumeOtherKeys() {
            ScrollList list = thirtyLines();

            assertThat(list.update(KeyPress.of('q'))).isFalse();
            assertThat(list.update(KeyPress.UP)).isFalse();
            assertThat(list.update(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Indicators")
    class IndicatorTest {

        @Test
        @DisplayName("should report scroll percent across the range")
        void shouldReportPercent() {
            ScrollList list = ScrollList.builder().withSize(40, 10).withItemSeparators(false).build();
            assertThat(list.scrollPercent()).isZero();

            list.setItems(singleLineItems(5));
            assertThat(list.scrollPercent()).isEqualTo(1.0);

            list.setItems(singleLineItems(30));
            assertThat(list.scrollPercent()).isEqualTo(1.0);
            list.gotoTop();
            assertThat(list.scrollPercent()).isZero();
            list.scrollBy(10);
            assertThat(list.scrollPercent()).isEqualTo(0.5);
            assertThat(list.firstVisibleLine()).isEqualTo(10);
            assertThat(list.totalLineCount()).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("Mutation")
    class MutationTest {

        @Test
        @DisplayName("should find items by id and replace them in place")
        void shouldReplaceInPlace() {
            ScrollList list = new ScrollList(40, 10);
            list.setItems(List.of(item("a", 1), item("b", 1)));

            list.replaceItem(list.indexOf("b"), item("c", 2));

            assertThat(list.indexOf("b")).isEqualTo(-1);
            assertThat(list.indexOf("c")).isEqualTo(1);
            assertThat(list.itemAt(1).id()).isEqualTo("c");
            assertThat(list.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject bad arguments")
        void shouldRejectBadArguments() {
            ScrollList list = new ScrollList(40, 10);

            assertThatThrownBy(() -> list.replaceItem(0, item("a", 1)))
                .isInstanceOf(IndexOutOfBoundsException.class);
            assertThatThrownBy(() -> list.appendItem(null))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> list.items().add(item("x", 1)))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("should follow an item that grows in place")
        void shouldFollowGrowingItem() {
            ScrollList list = new ScrollList(20, 3);
            TextItem text = new TextItem("t", "start");
            list.appendItem(text);

            for (int i = 0; i < 10; i++) {
                text.append("\nline " + i);
                list.contentChanged();
                assertThat(list.atBottom()).isTrue();
            }
            assertThat(list.viewLines()).containsExactly("│ line 7", "│ line 8", "│ line 9");
        }

        @Test
        @DisplayName("should reset on clear")
        void shouldClear() {
            ScrollList list = new ScrollList(40, 2);
            list.setItems(singleLineItems(10));
            list.setSelected(3);

            list.clear();

            assertThat(list.isEmpty()).isTrue();
            assertThat(list.cursor()).isEqualTo(ScrollCursor.TOP);
            assertThat(list.selectedIndex()).isEqualTo(-1);
        }

        @Test
        @DisplayName("should keep the cursor in bounds under random operations")
        void shouldKeepCursorInBounds() {
            Random random = new Random(42);
            ScrollList list = new ScrollList(30, 8);
            int next = 0;

            for (int step = 0; step < 3000; step++) {
                int op = random.nextInt(9);
                switch (op) {
                    case 0, 1 -> list.appendItem(item("r" + next++, 1 + random.nextInt(6)));
                    case 2 -> {
                        int keep = list.isEmpty() ? 0 : random.nextInt(list.size() + 1);
                        list.setItems(new ArrayList<>(list.items().subList(0, keep)));
                    }
                    case 3 -> list.scrollBy(random.nextInt(41) - 20);
                    case 4 -> list.setSize(10 + random.nextInt(60), random.nextInt(15));
                    case 5 -> list.setAutoScroll(random.nextBoolean());
                    case 6 -> list.appendItem(ToolItem.builder("tool" + next++)
                        .withTitle("bash")
                        .withOutput("x\n".repeat(random.nextInt(15)))
                        .build());
                    case 7 -> {
                        if (!list.isEmpty()) {
                            list.replaceItem(random.nextInt(list.size()), item("s" + next++, 1 + random.nextInt(3)));
                        }
                    }
                    default -> {
                        if (random.nextBoolean()) {
                            list.gotoTop();
                        } else {
                            list.gotoBottom();
                        }
                    }
                }

                List<String> view = list.viewLines();
                assertThat(view.size()).isLessThanOrEqualTo(list.height());
                ScrollCursor cursor = list.cursor();
                if (list.isEmpty()) {
                    assertThat(cursor).isEqualTo(ScrollCursor.TOP);
                    continue;
                }
                assertThat(cursor.itemIndex()).as("step %d op %d", step, op).isBetween(0, list.size() - 1);
                int height = list.itemAt(cursor.itemIndex()).render(list.width()).size();
                assertThat(cursor.lineOffset()).as("step %d op %d", step, op).isBetween(0, height - 1);
            }
        }
    }
}
