package com.livestockmart.marketplace.mapper;

import com.livestockmart.marketplace.dto.ListingResponse;
import com.livestockmart.marketplace.model.Listing;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ListingMapper {

    ListingResponse toListingResponse(Listing listing);
}
