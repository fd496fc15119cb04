package com.company.radar.repository;

import com.company.radar.domain.Property;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyRepositoryIntegrationTest extends BaseRepositoryIntegrationTest {

    private PropertyRepository propertyRepository;

    @BeforeEach
    void setUp() {
        propertyRepository = new PropertyRepository(jdbcTemplate);
    }

    @Test
    void shouldListOnlyPropertiesOfAccountOrderedBySiteUrl() {
        // given
        UUID accountId = createAccount("owner@example.com");
        UUID otherAccount = createAccount("other@example.com");
        createProperty(accountId, "sc-domain:example.com");
        createProperty(accountId, "https://example.com/");
        createProperty(otherAccount, "https://other.example/");

        // when
        List<Property> properties = propertyRepository.findAllByAccount(accountId);

        // then
        assertThat(properties).extracting(Property::getSiteUrl)
                .containsExactly("https://example.com/", "sc-domain:example.com");
        assertThat(properties).allSatisfy(property -> assertThat(property.getAccountId()).isEqualTo(accountId));
    }
}
