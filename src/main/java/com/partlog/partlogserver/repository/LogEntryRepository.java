package com.partlog.partlogserver.repository;

import com.partlog.partlogserver.entity.EntityKind;
import com.partlog.partlogserver.entity.log.AbstractLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LogEntryRepository extends JpaRepository<AbstractLogEntry, Long> {

    // История конкретного элемента, по возрастанию id (порядок записи)
    List<AbstractLogEntry> findAllByTargetTypeAndTargetIdOrderByIdAsc(EntityKind targetType, Long targetId);
}
