package org.kingstonaccess.service.model;

public interface Locatable {

    GeoPoint location();
}
