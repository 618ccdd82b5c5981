package com.property.reconciliation.bulk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.property.reconciliation.api.PropertyUpdateRequest;
import com.property.reconciliation.api.ValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * One source update as integrations serialize it. Unknown keys are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PropertyUpdatePayload(
        @JsonProperty("source") String source,
        @JsonProperty("mls_id") String mlsId,
        @JsonProperty("property_id") String propertyId,
        @JsonProperty("address") String address,
        @JsonProperty("city") String city,
        @JsonProperty("state") String state,
        @JsonProperty("zip_code") String zipCode,
        @JsonProperty("bedrooms") Integer bedrooms,
        @JsonProperty("bathrooms") Double bathrooms,
        @JsonProperty("square_feet") Integer squareFeet,
        @JsonProperty("property_type") String propertyType,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("description") String description,
        @JsonProperty("images") List<String> images,
        @JsonProperty("agent") String agent,
        @JsonProperty("office") String office,
        @JsonProperty("source_url") String sourceUrl,
        @JsonProperty("available") Boolean available,
        @JsonProperty("internal_notes") String internalNotes,
        @JsonProperty("status") String status,
        @JsonProperty("observed_at") String observedAt,
        @JsonProperty("replace_images") Boolean replaceImages
) {

    /**
     * Listing id when present, otherwise the property id.
     */
    public String reference() {
        return mlsId != null ? mlsId : propertyId;
    }

    /**
     * @throws ValidationException if the payload does not describe a valid update
     */
    public PropertyUpdateRequest toRequest() {
        PropertyUpdateRequest.Builder builder = PropertyUpdateRequest.builder(source)
                .listingId(mlsId)
                .propertyId(propertyId)
                .address(address)
                .city(city)
                .state(state)
                .postalCode(zipCode)
                .bedrooms(bedrooms)
                .bathrooms(bathrooms)
                .squareFeet(squareFeet)
                .propertyType(propertyType)
                .price(price)
                .description(description)
                .images(images)
                .agent(agent)
                .office(office)
                .sourceUrl(sourceUrl)
                .available(available)
                .internalNotes(internalNotes)
                .status(status)
                .replaceImages(Boolean.TRUE.equals(replaceImages));
        if (observedAt != null) {
            try {
                builder.observedAt(Instant.parse(observedAt));
            } catch (DateTimeParseException e) {
                throw new ValidationException("observed_at must be an ISO-8601 instant");
            }
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "PropertyUpdatePayload{source='" + source + '\'' +
                ", mlsId='" + mlsId + '\'' +
                ", propertyId='" + propertyId + '\'' +
                ", status='" + status + '\'' + '}';
    }
}
