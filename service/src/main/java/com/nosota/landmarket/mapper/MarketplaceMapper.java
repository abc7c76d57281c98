package com.nosota.landmarket.mapper;

import com.nosota.landmarket.api.response.BuyRequestResponse;
import com.nosota.landmarket.api.response.FeatureResponse;
import com.nosota.landmarket.api.response.SellRequestResponse;
import com.nosota.landmarket.model.BuyRequest;
import com.nosota.landmarket.model.Feature;
import com.nosota.landmarket.model.SellRequest;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper from marketplace entities to API responses.
 */
@Mapper
public interface MarketplaceMapper {

    MarketplaceMapper INSTANCE = Mappers.getMapper(MarketplaceMapper.class);

    BuyRequestResponse toResponse(BuyRequest buyRequest);

    List<BuyRequestResponse> toBuyRequestResponses(List<BuyRequest> buyRequests);

    SellRequestResponse toResponse(SellRequest sellRequest);

    List<SellRequestResponse> toSellRequestResponses(List<SellRequest> sellRequests);

    FeatureResponse toResponse(Feature feature);
}
