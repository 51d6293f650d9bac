package com.acme.voice.dispatch.handler;

import com.acme.voice.domain.BookingSummary;
import com.acme.voice.domain.DocumentSummary;
import com.acme.voice.domain.MaintenanceRecord;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.intent.IotOperation;
import com.acme.voice.intent.SensorKind;
import com.acme.voice.repository.BimModelRepository;
import com.acme.voice.repository.BookingRepository;
import com.acme.voice.repository.DocumentRepository;
import com.acme.voice.repository.MaintenanceRepository;
import com.acme.voice.repository.NodeRepository;
import com.acme.voice.spi.ConversionTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActionHandlersTest {

    private static final CommandContext CTX = new CommandContext("T1", "U1", 3L, null, 5L);
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private ConversionTrigger conversionTrigger;
    @Mock
    private BimModelRepository bimModelRepository;
    @Mock
    private DocumentRepository documentRepository;
    @Mock
    private MaintenanceRepository maintenanceRepository;
    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private NodeRepository nodeRepository;

    @Nested
    @DisplayName("Device And Sensor Tests")
    class DeviceTests {

        @Test
        @DisplayName("IotControlHandler - should report the simulated command as executed")
        void testIot() {
            Map<String, Object> payload = new IotControlHandler().execute(
                    new Actions.IotControl(IotOperation.TURN_OFF, 11L, "Luce Soggiorno"), CTX);

            assertThat(payload).containsEntry("node_id", 11L)
                    .containsEntry("action", "turn_off")
                    .containsEntry("status", "executed");
        }

        @Test
        @DisplayName("SensorReadHandler - should return a value and a unit")
        void testSensor() {
            SensorReadHandler handler = new SensorReadHandler(CLOCK);

            Map<String, Object> temperature =
                    handler.execute(new Actions.SensorRead(SensorKind.TEMPERATURE, 3L), CTX);
            Map<String, Object> humidity =
                    handler.execute(new Actions.SensorRead(SensorKind.HUMIDITY, 3L), CTX);

            assertThat(temperature).containsEntry("temperature", 22.5).containsEntry("unit", "°C")
                    .containsEntry("timestamp", NOW.toString());
            assertThat(humidity).containsEntry("humidity", 45.2).containsEntry("unit", "%");
        }

        @Test
        @DisplayName("SystemStatusHandler - should count active nodes and pending maintenance")
        void testSystemStatus() {
            when(nodeRepository.countActiveByHouse(3L)).thenReturn(4);
            when(maintenanceRepository.countPendingByHouse(3L)).thenReturn(1);

            Map<String, Object> payload = new SystemStatusHandler(nodeRepository, maintenanceRepository, CLOCK)
                    .execute(new Actions.SystemStatus(3L), CTX);

            assertThat(payload).containsEntry("active_nodes", 4)
                    .containsEntry("pending_maintenance", 1)
                    .containsEntry("system_status", "operational");
        }

        @Test
        @DisplayName("HelpHandler - should list the available commands")
        void testHelp() {
            assertThat(new HelpHandler().execute(new Actions.Help(), CTX))
                    .containsEntry("commands", HelpHandler.COMMANDS);
        }
    }

    @Nested
    @DisplayName("Lookup Tests")
    class LookupTests {

        @Test
        @DisplayName("BimConversionHandler - should return the job id of the triggered conversion")
        void testBimConversion() {
            when(conversionTrigger.trigger(7L, "auto")).thenReturn("job-1");

            Map<String, Object> payload = new BimConversionHandler(conversionTrigger)
                    .execute(new Actions.BimConversion(7L, "Villa", "auto"), CTX);

            assertThat(payload).containsEntry("task_id", "job-1").containsEntry("status", "started");
        }

        @Test
        @DisplayName("BimStatusHandler - should total the models per status")
        void testBimStatus() {
            when(bimModelRepository.countByStatus("U1")).thenReturn(Map.of("pending", 2, "completed", 3));

            Map<String, Object> payload = new BimStatusHandler(bimModelRepository)
                    .execute(new Actions.BimStatus("U1"), CTX);

            assertThat(payload).containsEntry("count", 5);
        }

        @Test
        @DisplayName("DocumentListHandler - should use the configured limit")
        void testDocumentList() {
            when(documentRepository.findByUser("U1", 10)).thenReturn(List.of(
                    new DocumentSummary(1L, "Contratto.pdf", "pdf", NOW)));

            Map<String, Object> payload = new DocumentListHandler(documentRepository, 10)
                    .execute(new Actions.DocumentList("U1"), CTX);

            assertThat(payload).containsEntry("count", 1);
            assertThat(payload.get("documents")).isEqualTo(List.of(Map.of("id", 1L, "name", "Contratto.pdf")));
        }

        @Test
        @DisplayName("DocumentSearchHandler - should not query without search terms")
        void testDocumentSearchWithoutTerms() {
            Map<String, Object> payload = new DocumentSearchHandler(documentRepository, 10)
                    .execute(new Actions.DocumentSearch("U1", "cerca documento", List.of()), CTX);

            assertThat(payload).containsEntry("count", 0);
            verifyNoInteractions(documentRepository);
        }

        @Test
        @DisplayName("MaintenanceStatusHandler - should count pending and in progress records")
        void testMaintenanceStatus() {
            when(maintenanceRepository.findByUser("U1", 5)).thenReturn(List.of(
                    new MaintenanceRecord(1L, "T1", "U1", 3L, "caldaia", "pending", NOW),
                    new MaintenanceRecord(2L, "T1", "U1", 3L, "tetto", "in_progress", NOW),
                    new MaintenanceRecord(3L, "T1", "U1", 3L, "porta", "done", NOW)));

            Map<String, Object> payload = new MaintenanceStatusHandler(maintenanceRepository, 5)
                    .execute(new Actions.MaintenanceStatus("U1"), CTX);

            assertThat(payload).containsEntry("count", 3).containsEntry("pending", 1L).containsEntry("in_progress", 1L);
        }

        @Test
        @DisplayName("BookingListHandler - should summarize bookings")
        void testBookingList() {
            when(bookingRepository.findByUser("U1", 5)).thenReturn(List.of(
                    new BookingSummary(4L, "T1", "U1", 3L, "Sala riunioni", "requested", NOW)));

            Map<String, Object> payload = new BookingListHandler(bookingRepository, 5)
                    .execute(new Actions.BookingList("U1"), CTX);

            assertThat(payload).containsEntry("count", 1);
        }
    }

    @Nested
    @DisplayName("Create Tests")
    class CreateTests {

        @Test
        @DisplayName("MaintenanceCreateHandler - should insert a pending request for the house")
        void testMaintenanceCreate() {
            when(maintenanceRepository.create(any())).thenReturn(42L);

            Map<String, Object> payload = new MaintenanceCreateHandler(maintenanceRepository, CLOCK)
                    .execute(new Actions.MaintenanceCreate("U1", 3L, "nuova manutenzione caldaia"), CTX);

            ArgumentCaptor<MaintenanceRecord> captor = ArgumentCaptor.forClass(MaintenanceRecord.class);
            verify(maintenanceRepository).create(captor.capture());
            assertThat(captor.getValue().tenantId()).isEqualTo("T1");
            assertThat(captor.getValue().status()).isEqualTo("pending");
            assertThat(captor.getValue().createdAt()).isEqualTo(NOW);
            assertThat(payload).containsEntry("maintenance_id", 42L);
        }

        @Test
        @DisplayName("BookingCreateHandler - should refuse commands without a house")
        void testBookingWithoutHouse() {
            BookingCreateHandler handler = new BookingCreateHandler(bookingRepository, CLOCK);

            assertThatThrownBy(() -> handler.execute(new Actions.BookingCreate("U1", null, "prenota stanza"), CTX))
                    .isInstanceOf(IllegalStateException.class);
            verifyNoInteractions(bookingRepository);
        }

        @Test
        @DisplayName("BookingCreateHandler - should file a booking request")
        void testBookingCreate() {
            when(bookingRepository.createRequest(any())).thenReturn(9L);

            Map<String, Object> payload = new BookingCreateHandler(bookingRepository, CLOCK)
                    .execute(new Actions.BookingCreate("U1", 3L, "prenota stanza"), CTX);

            assertThat(payload).containsEntry("booking_id", 9L).containsEntry("status", "requested");
        }
    }
}
