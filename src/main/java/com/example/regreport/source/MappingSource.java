package com.example.regreport.source;

import com.example.regreport.model.MappingTables;

public interface MappingSource {

    MappingTables loadMappings();
}
