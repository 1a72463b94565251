package io.prepro.core.directive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class ConditionalStackTest {

    private final ConditionalStack stack = new ConditionalStack();

    @Test
    void shouldBeActiveWhenEmpty() {
        assertThat(stack.isActive()).isTrue();
        assertThat(stack.isEmpty()).isTrue();
        assertThat(stack.peek()).isEmpty();
    }

    @Test
    void shouldSelectElseOnlyWhenThenNotTaken() {
        Frame frame = stack.pushIf(false, 1);
        assertThat(stack.isActive()).isFalse();

        assertThat(frame.enterElse()).isTrue();
        assertThat(stack.isActive()).isTrue();
        assertThat(frame.enterElse()).isFalse();
    }

    @Test
    void shouldKeepChildrenInactiveUnderInactiveParent() {
        stack.pushIf(false, 1);
        Frame child = stack.pushIf(true, 2);

        assertThat(child.isParentActive()).isFalse();
        assertThat(stack.isActive()).isFalse();

        child.enterElse();
        assertThat(stack.isActive()).isFalse();
        assertThat(stack.depth()).isEqualTo(2);
    }

    @Test
    void shouldSelectFirstMatchingCase() {
        Frame frame = stack.pushSwitch("b", 1);
        assertThat(frame.switchValue()).isEqualTo("b");
        assertThat(frame.isSelected()).isFalse();

        assertThat(frame.enterCase("a")).isTrue();
        assertThat(stack.isActive()).isFalse();
        assertThat(frame.enterCase("b")).isTrue();
        assertThat(stack.isActive()).isTrue();
        frame.enterDefault();
        assertThat(stack.isActive()).isFalse();
    }

    @Test
    void shouldSelectDefaultWhenNoCaseMatched() {
        Frame frame = stack.pushSwitch("z", 1);
        frame.enterCase("a");

        frame.enterDefault();

        assertThat(stack.isActive()).isTrue();
        assertThat(frame.isDefaultSeen()).isTrue();
    }

    @Test
    void shouldRejectDuplicateCaseValues() {
        Frame frame = stack.pushSwitch("z", 1);

        assertThat(frame.enterCase("a")).isTrue();
        assertThat(frame.enterCase("a")).isFalse();
    }

    @Test
    void shouldPopInnermostFrame() {
        stack.pushIf(true, 1);
        stack.pushSwitch("x", 2);

        assertThat(stack.pop().kind()).isEqualTo(FrameKind.SWITCH);
        assertThat(stack.pop().openedAt()).isEqualTo(1);
        assertThatThrownBy(stack::pop).isInstanceOf(NoSuchElementException.class);
    }
}
