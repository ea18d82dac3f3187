package com.partlog.partlogserver.services;

import com.partlog.partlogserver.config.ChangeLogProperties;
import com.partlog.partlogserver.entity.EntityKind;
import com.partlog.partlogserver.entity.Part;
import com.partlog.partlogserver.entity.PartLot;
import com.partlog.partlogserver.entity.log.AbstractLogEntry;
import com.partlog.partlogserver.entity.log.CollectionElementDeleted;
import com.partlog.partlogserver.entity.log.ElementCreatedLogEntry;
import com.partlog.partlogserver.entity.log.ElementDeletedLogEntry;
import com.partlog.partlogserver.entity.log.ElementEditedLogEntry;
import com.partlog.partlogserver.repository.LogEntryRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class JpaUnitOfWorkTest {

    @Autowired
    private TestEntityManager testEntityManager;

    @Autowired
    private LogEntryRepository logEntryRepository;

    private ChangeLogProperties properties;
    private EventCommentHelper commentHelper;
    private ChangeCaptureService changeCaptureService;
    private Part part;
    private JpaUnitOfWork current;

    @BeforeEach
    void setUp() {
        properties = new ChangeLogProperties();
        commentHelper = new EventCommentHelper();
        FieldRedactionPolicy redactionPolicy = FieldRedactionPolicy.defaultPolicy();
        changeCaptureService = new ChangeCaptureService(new EventLogger(logEntryRepository, properties),
                commentHelper, new ChangeSetBuilder(redactionPolicy), redactionPolicy,
                AssociationLogPolicy.defaultPolicy(), properties);

        part = testEntityManager.persistAndFlush(new Part("R1"));
    }

    @AfterEach
    void tearDown() {
        if (current != null) {
            current.close();
        }
    }

    private JpaUnitOfWork newUnitOfWork() {
        current = new JpaUnitOfWork(testEntityManager.getEntityManager());
        return current;
    }

    private List<AbstractLogEntry> reloadLog(EntityKind kind, Long id) {
        testEntityManager.clear();
        return logEntryRepository.findAllByTargetTypeAndTargetIdOrderByIdAsc(kind, id);
    }

    @Test
    @DisplayName("Создание пишется с настоящим id и количеством")
    void shouldLogCreationWithAssignedId() {
        JpaUnitOfWork uow = newUnitOfWork();
        PartLot lot = uow.persist(new PartLot(part, new BigDecimal("5")));
        commentHelper.setMessage("приход");

        changeCaptureService.flush(uow);

        assertThat(lot.getId()).isNotNull();
        List<AbstractLogEntry> entries = reloadLog(EntityKind.PART_LOT, lot.getId());
        assertThat(entries).hasSize(1);
        ElementCreatedLogEntry created = (ElementCreatedLogEntry) entries.get(0);
        assertThat(created.getCreationInstockValue()).isEqualTo("5");
        assertThat(created.getComment()).isEqualTo("приход");
        assertThat(created.getUsername()).isEqualTo(EventLogger.ANONYMOUS_USER);
        assertThat(created.getTimestamp()).isNotNull();
        assertThat(commentHelper.isMessageSet()).isFalse();
    }

    @Test
    @DisplayName("Правка пишет список изменённых полей")
    void shouldLogEditedFieldNames() {
        JpaUnitOfWork uow = newUnitOfWork();
        uow.track(part);
        part.setDescription("SMD 0805");

        changeCaptureService.flush(uow);

        List<AbstractLogEntry> entries = reloadLog(EntityKind.PART, part.getId());
        assertThat(entries).hasSize(1);
        ElementEditedLogEntry edited = (ElementEditedLogEntry) entries.get(0);
        assertThat(edited.getChangedFields()).containsExactly("description");
        assertThat(edited.hasOldDataInformation()).isFalse();
    }

    @Test
    @DisplayName("Правка со старыми данными")
    void shouldLogEditedOldData() {
        properties.setSaveChangedData(true);
        JpaUnitOfWork uow = newUnitOfWork();
        uow.track(part);
        part.setName("R2");

        changeCaptureService.flush(uow);

        ElementEditedLogEntry edited = (ElementEditedLogEntry) reloadLog(EntityKind.PART, part.getId()).get(0);
        assertThat(edited.getOldData()).containsEntry("name", "R1");
    }

    @Test
    @DisplayName("Удаление партии пишет запись о родительской коллекции")
    void shouldLogCollectionElementDeleted() {
        PartLot lot = testEntityManager.persistAndFlush(new PartLot(part, new BigDecimal("3")));
        properties.setSaveChangedData(true);
        JpaUnitOfWork uow = newUnitOfWork();
        uow.remove(lot);

        changeCaptureService.flush(uow);

        List<AbstractLogEntry> lotEntries = reloadLog(EntityKind.PART_LOT, lot.getId());
        assertThat(lotEntries).hasSize(1);
        ElementDeletedLogEntry deleted = (ElementDeletedLogEntry) lotEntries.get(0);
        assertThat(deleted.getOldData()).containsEntry("amount", "3");

        List<AbstractLogEntry> partEntries = logEntryRepository
                .findAllByTargetTypeAndTargetIdOrderByIdAsc(EntityKind.PART, part.getId());
        assertThat(partEntries).hasSize(1);
        CollectionElementDeleted collection = (CollectionElementDeleted) partEntries.get(0);
        assertThat(collection.getCollectionName()).isEqualTo("partLots");
        assertThat(collection.getDeletedElementKind()).isEqualTo(EntityKind.PART_LOT);
        assertThat(collection.getDeletedElementId()).isEqualTo(lot.getId());
        assertThat(testEntityManager.find(PartLot.class, lot.getId())).isNull();
    }

    @Test
    @DisplayName("Связи читаются из метамодели вместе с обратной коллекцией")
    void shouldReadAssociationMappings() {
        Map<String, AssociationMapping> mappings = newUnitOfWork().associationMappings(PartLot.class);

        assertThat(mappings).containsOnlyKeys("part");
        assertThat(mappings.get("part").getTargetClass()).isEqualTo(Part.class);
        assertThat(mappings.get("part").getInversedBy()).isEqualTo("partLots");
    }

    @Test
    @DisplayName("Повторная фиксация запрещена")
    void shouldRefuseReuseAfterCommit() {
        JpaUnitOfWork uow = newUnitOfWork();
        changeCaptureService.flush(uow);

        assertThatThrownBy(() -> uow.persist(new PartLot(part, BigDecimal.ONE)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Правка управляемой сущности видна без track()")
    void shouldLogEditOfUntrackedManagedEntity() {
        testEntityManager.clear();
        Part loaded = testEntityManager.find(Part.class, part.getId());
        JpaUnitOfWork uow = newUnitOfWork();
        loaded.setDescription("changed");

        changeCaptureService.flush(uow);

        List<AbstractLogEntry> entries = reloadLog(EntityKind.PART, part.getId());
        assertThat(entries).hasSize(1);
        assertThat(((ElementEditedLogEntry) entries.get(0)).getChangedFields()).containsExactly("description");
        assertThat(testEntityManager.find(Part.class, part.getId()).getDescription()).isEqualTo("changed");
    }

    @Test
    @DisplayName("Вставка мимо единицы работы тоже даёт запись о создании")
    void shouldLogInsertMadeDirectlyThroughEntityManager() {
        JpaUnitOfWork uow = newUnitOfWork();
        PartLot lot = testEntityManager.persist(new PartLot(part, new BigDecimal("2")));

        changeCaptureService.flush(uow);

        List<AbstractLogEntry> entries = reloadLog(EntityKind.PART_LOT, lot.getId());
        assertThat(entries).hasSize(1);
        assertThat(((ElementCreatedLogEntry) entries.get(0)).getCreationInstockValue()).isEqualTo("2");
    }

    @Test
    @DisplayName("Удаление мимо единицы работы тоже журналируется со старыми данными")
    void shouldLogRemoveMadeDirectlyThroughEntityManager() {
        PartLot lot = testEntityManager.persistAndFlush(new PartLot(part, new BigDecimal("4")));
        JpaUnitOfWork uow = newUnitOfWork();
        testEntityManager.remove(lot);

        changeCaptureService.flush(uow);

        List<AbstractLogEntry> entries = reloadLog(EntityKind.PART_LOT, lot.getId());
        assertThat(entries).hasSize(1);
        ElementDeletedLogEntry deleted = (ElementDeletedLogEntry) entries.get(0);
        assertThat(deleted.getOldData()).containsEntry("amount", "4");
        assertThat(testEntityManager.find(PartLot.class, lot.getId())).isNull();
    }

    @Test
    @DisplayName("Другой масштаб того же BigDecimal не считается правкой")
    void shouldIgnoreBigDecimalScaleChange() {
        part.setMinAmount(new BigDecimal("3"));
        testEntityManager.flush();
        JpaUnitOfWork uow = newUnitOfWork();
        part.setMinAmount(new BigDecimal("3.00"));

        assertThat(uow.pendingUpdates()).isEmpty();
        changeCaptureService.flush(uow);

        assertThat(reloadLog(EntityKind.PART, part.getId())).isEmpty();
    }

    @Test
    @DisplayName("После фиксации единица работы снята с потока")
    void shouldDeactivateAfterCommit() {
        JpaUnitOfWork uow = newUnitOfWork();
        assertThat(JpaUnitOfWork.active()).isSameAs(uow);

        changeCaptureService.flush(uow);

        assertThat(JpaUnitOfWork.active()).isNull();
    }
}
