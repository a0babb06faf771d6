package com.kabadi.pickupservice.service;

import com.kabadi.pickupservice.dto.VendorLocationRequest;
import com.kabadi.pickupservice.dto.VendorLocationResponse;

public interface VendorService {

    /**
     * Records a vendor's presence: location, offer URL and last-seen time.
     * Unknown vendors are registered on their first ping.
     */
    VendorLocationResponse updateLocation(VendorLocationRequest request);
}
