package org.transparentclassroom.client.model;

public enum CallShape {

    DETAIL, // single-object fetch by id
    LIST;   // collection fetch, reduced field subset

}
