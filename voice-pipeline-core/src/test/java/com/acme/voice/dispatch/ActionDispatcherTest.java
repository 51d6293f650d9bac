package com.acme.voice.dispatch;

import com.acme.voice.core.InternalConsistencyException;
import com.acme.voice.dispatch.handler.HelpHandler;
import com.acme.voice.dispatch.handler.IotControlHandler;
import com.acme.voice.intent.Action;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.intent.IotOperation;
import com.acme.voice.repository.ActionLedgerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActionDispatcherTest {

    private static final CommandContext CTX = new CommandContext("T1", "U1", 3L, null, 5L);

    @Mock
    private ActionLedgerRepository ledger;

    private ActionHandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ActionHandlerRegistry();
        registry.register(new HelpHandler());
        registry.register(new IotControlHandler());
    }

    /** Handler that always fails, to check sibling isolation. */
    private static class FailingBimStatusHandler implements ActionHandler<Actions.BimStatus> {
        @Override
        public ActionType type() {
            return ActionType.BIM_STATUS;
        }

        @Override
        public Class<Actions.BimStatus> actionClass() {
            return Actions.BimStatus.class;
        }

        @Override
        public Map<String, Object> execute(Actions.BimStatus action, CommandContext context) {
            throw new IllegalStateException("Servizio BIM non raggiungibile");
        }
    }

    @Nested
    @DisplayName("Dispatch Tests")
    class DispatchTests {

        @Test
        @DisplayName("dispatch - should keep running siblings after a handler failure")
        void testSiblingIsolation() {
            registry.register(new FailingBimStatusHandler());
            ActionDispatcher dispatcher = new ActionDispatcher(registry, ledger, false);
            List<Action> actions = List.of(new Actions.BimStatus("U1"), new Actions.Help());

            List<ActionResult> results = dispatcher.dispatch(actions, CTX);

            assertThat(results).hasSize(2);
            assertThat(results.get(0).success()).isFalse();
            assertThat(results.get(0).error()).isEqualTo("Servizio BIM non raggiungibile");
            assertThat(results.get(1).success()).isTrue();
            verifyNoInteractions(ledger);
        }

        @Test
        @DisplayName("dispatch - should fail before running anything for an unregistered type")
        void testUnregistered() {
            ActionDispatcher dispatcher = new ActionDispatcher(registry, ledger, false);

            assertThatThrownBy(() -> dispatcher.dispatch(List.of(new Actions.BimStatus("U1")), CTX))
                    .isInstanceOf(InternalConsistencyException.class);
        }

        @Test
        @DisplayName("dispatch - should return an empty list for no actions")
        void testEmpty() {
            ActionDispatcher dispatcher = new ActionDispatcher(registry, ledger, true);

            assertThat(dispatcher.dispatch(List.of(), CTX)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Idempotency Ledger Tests")
    class LedgerTests {

        private final Action turnOn = new Actions.IotControl(IotOperation.TURN_ON, 11L, "Luce Soggiorno");

        @Test
        @DisplayName("dispatch - should record side-effecting results under record:index:type")
        void testRecords() {
            when(ledger.findResult("5:1:iot_control")).thenReturn(Optional.empty());
            ActionDispatcher dispatcher = new ActionDispatcher(registry, ledger, true);

            List<ActionResult> results = dispatcher.dispatch(List.of(new Actions.Help(), turnOn), CTX);

            assertThat(results).allMatch(ActionResult::success);
            verify(ledger).recordIfAbsent(eq("5:1:iot_control"), eq(5L), eq("iot_control"), contains("executed"));
            verify(ledger, never()).findResult(startsWith("5:0"));
        }

        @Test
        @DisplayName("dispatch - should replay a stored result instead of running the handler again")
        void testReplay() {
            when(ledger.findResult("5:0:iot_control"))
                    .thenReturn(Optional.of("{\"node_id\":11,\"status\":\"executed\"}"));
            ActionDispatcher dispatcher = new ActionDispatcher(registry, ledger, true);

            List<ActionResult> results = dispatcher.dispatch(List.of(turnOn), CTX);

            assertThat(results.get(0).success()).isTrue();
            assertThat(results.get(0).payload()).containsEntry("replayed", true).containsEntry("node_id", 11);
            verify(ledger, never()).recordIfAbsent(anyString(), anyLong(), anyString(), anyString());
        }

        @Test
        @DisplayName("dispatch - should keep the result when the ledger write fails")
        void testLedgerWriteFailure() {
            when(ledger.findResult(anyString())).thenReturn(Optional.empty());
            when(ledger.recordIfAbsent(anyString(), anyLong(), anyString(), anyString()))
                    .thenThrow(new RuntimeException("db down"));
            ActionDispatcher dispatcher = new ActionDispatcher(registry, ledger, true);

            List<ActionResult> results = dispatcher.dispatch(List.of(turnOn), CTX);

            assertThat(results.get(0).success()).isTrue();
        }
    }
}
