package com.kreasipositif.ledgerservice;

import com.kreasipositif.ledgerservice.dto.CounterpartyAliasDto;
import com.kreasipositif.ledgerservice.service.ClientDirectoryService;
import com.kreasipositif.ledgerservice.service.CounterpartyAliasService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for alias upserts and BIN backfill.
 */
@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class CounterpartyAliasServiceTests {

    @Autowired
    private CounterpartyAliasService aliasService;

    @Autowired
    private ClientDirectoryService clientDirectoryService;

    // ─── Aliases ──────────────────────────────────────────────────────────────

    @Test
    void seededAliasIsListed() {
        assertThat(aliasService.findAll())
                .extracting(CounterpartyAliasDto::getClientId)
                .containsExactly("3");
    }

    @Test
    void sameAliasTwiceIsNoOp() {
        var first = aliasService.upsert(new CounterpartyAliasDto("ТОО  Степь  Логистик", "", "4"));
        var second = aliasService.upsert(new CounterpartyAliasDto("тоо степь логистик", "", "4"));

        assertThat(first.isChanged()).isTrue();
        assertThat(second.isChanged()).isFalse();
        assertThat(aliasService.findAll()).hasSize(2);
    }

    @Test
    void binKeyedAliasIsLastWriteWins() {
        aliasService.upsert(new CounterpartyAliasDto("Old name", "111222333444", "1"));
        var res = aliasService.upsert(new CounterpartyAliasDto("New name", "1112 2233 3444", "2"));

        assertThat(res.isChanged()).isTrue();
        assertThat(res.getBankBin()).isEqualTo("111222333444");
        assertThat(aliasService.findAll())
                .filteredOn(a -> a.getBankBin().equals("111222333444"))
                .singleElement()
                .extracting(CounterpartyAliasDto::getClientId)
                .isEqualTo("2");
    }

    @Test
    void aliasWithoutNameOrBinIsRejected() {
        assertThatThrownBy(() -> aliasService.upsert(new CounterpartyAliasDto(" ", "", "1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ─── BIN backfill ─────────────────────────────────────────────────────────

    @Test
    void binIsSetOnlyWhenEmpty() {
        var set = clientDirectoryService.backfillBin("2", "870412300555").orElseThrow();
        var again = clientDirectoryService.backfillBin("2", "000000000000").orElseThrow();

        assertThat(set.isUpdated()).isTrue();
        assertThat(again.isUpdated()).isFalse();
        assertThat(again.getBin()).isEqualTo("870412300555");
    }

    @Test
    void existingBinIsNeverOverwritten() {
        var res = clientDirectoryService.backfillBin("1", "999999999999").orElseThrow();

        assertThat(res.isUpdated()).isFalse();
        assertThat(res.getBin()).isEqualTo("180540012345");
    }

    @Test
    void unknownClientIsEmpty() {
        assertThat(clientDirectoryService.backfillBin("nope", "123456789012")).isEmpty();
    }
}
