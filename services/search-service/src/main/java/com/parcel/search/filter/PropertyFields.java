package com.parcel.search.filter;

/**
 * Index field names of the property document.
 */
public final class PropertyFields {
    public static final String BEDROOMS = "property_details.allBuildingsSummary.bedroomsCount";
    public static final String BATHROOMS = "property_details.allBuildingsSummary.bathroomsCount";
    public static final String LIVING_AREA = "property_details.allBuildingsSummary.livingAreaSquareFeet";

    public static final String TAX_ASSESSMENT_PATH = "property_details.taxAssessment";
    public static final String ASSESSED_VALUE =
        "property_details.taxAssessment.assessedValue.calculatedTotalValue";

    public static final String CITY = "propertyAddress.city";
    public static final String STATE = "propertyAddress.state";
    public static final String COUNTY = "propertyAddress.county";

    public static final String LAND_USE =
        "property_details.siteLocation.landUseAndZoningCodes.stateLandUseDescription";
    public static final String LOT_ACRES = "property_details.siteLocation.lot.areaAcres";

    public static final String OWNER_NAMES_PATH = "property_details.ownership.currentOwners.ownerNames";
    public static final String OWNER_IS_CORPORATE =
        "property_details.ownership.currentOwners.ownerNames.isCorporate";

    private PropertyFields() {
    }
}
